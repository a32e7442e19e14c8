/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp;

/**
 * State of a {@link RespClient}.
 *
 * <pre>
 *            execute()                 subscribe reply decoded
 *   IDLE ────────────→ AWAITING_REPLY ─────────────────────────→ SUBSCRIBED ⟲ readFrame()
 *    ↑ ⟲ readFrame()        │
 *    └──── reply decoded ───┘
 *
 *   any state ── close() / transport or protocol failure ──→ CLOSED
 * </pre>
 */
public enum ClientState {
  /** Ready for {@code execute()} or {@code readFrame()}. */
  IDLE,

  /** One request sent, its reply not yet fully decoded. */
  AWAITING_REPLY,

  /** Connection only carries push frames; {@code execute()} is a mode violation. */
  SUBSCRIBED,

  /** Socket released. Terminal. */
  CLOSED
}

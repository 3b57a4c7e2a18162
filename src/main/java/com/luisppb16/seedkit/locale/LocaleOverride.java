/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.locale;

import com.luisppb16.seedkit.model.Locale;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Scope of a temporary locale switch. Closing it reloads the locale that was current when the
 * scope was opened and reapplies the patches made under it. Once a close has succeeded, closing
 * again is a no-op; a close whose reload failed can be retried.
 */
public final class LocaleOverride implements AutoCloseable {

  private final LocaleContext context;
  @Getter private final Locale previous;
  private final List<Map<String, Object>> previousPatches;
  private boolean closed;

  LocaleOverride(
      final LocaleContext context,
      final Locale previous,
      final List<Map<String, Object>> previousPatches) {
    this.context = context;
    this.previous = previous;
    this.previousPatches = previousPatches;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    context.restore(previous, previousPatches);
    closed = true;
  }
}

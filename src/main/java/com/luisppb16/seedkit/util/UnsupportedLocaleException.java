/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.util;

import lombok.Getter;

@Getter
public class UnsupportedLocaleException extends RuntimeException {

  private final transient Object locale;

  public UnsupportedLocaleException(Object locale, String message) {
    super(message);
    this.locale = locale;
  }

  public UnsupportedLocaleException(Object locale) {
    this(locale, "Locale '" + locale + "' is not supported.");
  }
}

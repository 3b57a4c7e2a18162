/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum IsbnFormat implements ValuedEnum<String> {
  ISBN13("isbn-13"),
  ISBN10("isbn-10");

  private final String value;
}

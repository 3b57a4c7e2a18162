/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MetricPrefixSign implements ValuedEnum<String> {
  POSITIVE("positive"),
  NEGATIVE("negative");

  private final String value;
}

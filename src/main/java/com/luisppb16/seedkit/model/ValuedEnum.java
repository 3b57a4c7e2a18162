/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.model;

/**
 * An enum whose members carry an underlying value. Enum coercion hands out this value instead of
 * the member, so generator code does not depend on the enum's shape.
 *
 * @param <V> the value type
 */
public interface ValuedEnum<V> {

  V getValue();
}

/*
 * Copyright (c) 2026 Luis Paolo Pepe Barra (@LuisPPB16).
 * All rights reserved.
 */

package com.luisppb16.seedkit.model;

import lombok.Getter;

/** Units of the International System of Units, each with its name and symbol. */
@Getter
public enum MeasureUnit implements ValuedEnum<MeasureUnit.Unit> {
  MASS("gram", "gr"),
  INFORMATION("byte", "b"),
  THERMODYNAMIC_TEMPERATURE("kelvin", "K"),
  AMOUNT_OF_SUBSTANCE("mole", "mol"),
  ANGLE("radian", "r"),
  SOLID_ANGLE("steradian", "㏛"),
  FREQUENCY("hertz", "Hz"),
  FORCE("newton", "N"),
  PRESSURE("pascal", "P"),
  ENERGY("joule", "J"),
  POWER("watt", "W"),
  FLUX("watt", "W"),
  ELECTRIC_CHARGE("coulomb", "C"),
  VOLTAGE("volt", "V"),
  ELECTRIC_CAPACITANCE("farad", "F"),
  ELECTRIC_RESISTANCE("ohm", "Ω"),
  ELECTRICAL_CONDUCTANCE("siemens", "S"),
  MAGNETIC_FLUX("weber", "Wb"),
  MAGNETIC_FLUX_DENSITY("tesla", "T"),
  INDUCTANCE("henry", "H"),
  TEMPERATURE("Celsius", "°C"),
  RADIOACTIVITY("becquerel", "Bq");

  private final Unit value;

  MeasureUnit(final String name, final String symbol) {
    this.value = new Unit(name, symbol);
  }

  public record Unit(String name, String symbol) {}
}

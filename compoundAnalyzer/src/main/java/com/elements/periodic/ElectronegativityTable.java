/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.elements.periodic;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Pauling electronegativities indexed by atomic number, for H (1) through Nd (60).
 * He, Ne and Ar have no value.  Kr and Xe use the revised values.
 */
public class ElectronegativityTable {

  private static final double[] PAULING_VALUES = new double[] {
      // H, He (none), Li, Be, B, C, N, O, F, Ne (none)
      2.20, Double.NaN, 0.98, 1.57, 2.04, 2.55, 3.04, 3.44, 3.98, Double.NaN,
      // Na, Mg, Al, Si, P, S, Cl, Ar (none), K, Ca
      0.93, 1.31, 1.61, 1.90, 2.19, 2.58, 3.16, Double.NaN, 0.82, 1.00,
      // Sc, Ti, V, Cr, Mn, Fe, Co, Ni, Cu, Zn
      1.36, 1.54, 1.63, 1.66, 1.55, 1.83, 1.88, 1.91, 1.90, 1.65,
      // Ga, Ge, As, Se, Br, Kr, Rb, Sr, Y, Zr
      1.81, 2.01, 2.18, 2.55, 2.96, 3.00, 0.82, 0.95, 1.22, 1.33,
      // Nb, Mo, Tc, Ru, Rh, Pd, Ag, Cd, In, Sn
      1.60, 2.16, 1.90, 2.20, 2.28, 2.20, 1.93, 1.69, 1.78, 1.96,
      // Sb, Te, I, Xe, Cs, Ba, La, Ce, Pr, Nd
      2.05, 2.10, 2.66, 2.60, 0.79, 0.89, 1.10, 1.12, 1.13, 1.14,
  };

  private static final Map<Integer, Double> ELECTRONEGATIVITY_BY_ATOMIC_NUMBER;

  static {
    Map<Integer, Double> values = new HashMap<>();
    for (int i = 0; i < PAULING_VALUES.length; i++) {
      if (!Double.isNaN(PAULING_VALUES[i])) {
        values.put(i + 1, PAULING_VALUES[i]);
      }
    }
    ELECTRONEGATIVITY_BY_ATOMIC_NUMBER = Collections.unmodifiableMap(values);
  }

  private ElectronegativityTable() {
  }

  /**
   * Look up the Pauling electronegativity of an element.
   * @param atomicNumber The element's atomic number.
   * @return The electronegativity, or empty for noble gases and elements the table does not cover.
   */
  public static Optional<Double> getElectronegativity(Integer atomicNumber) {
    if (atomicNumber == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(ELECTRONEGATIVITY_BY_ATOMIC_NUMBER.get(atomicNumber));
  }
}

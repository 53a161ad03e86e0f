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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Enumerates some common elements with their categories and oxidation states.  Used when no element data file is
 * available.  Electronegativities come from {@link ElectronegativityTable}.
 */
public enum CommonElements {
  HYDROGEN(1, "H", "Hydrogen", ElementCategory.DIATOMIC_NONMETAL, -1, 0, 1),
  HELIUM(2, "He", "Helium", ElementCategory.NOBLE_GAS, 0),
  LITHIUM(3, "Li", "Lithium", ElementCategory.ALKALI_METAL, 0, 1),
  BERYLLIUM(4, "Be", "Beryllium", ElementCategory.ALKALINE_EARTH_METAL, 0, 1, 2),
  BORON(5, "B", "Boron", ElementCategory.METALLOID, -5, -1, 0, 1, 2, 3),
  CARBON(6, "C", "Carbon", ElementCategory.POLYATOMIC_NONMETAL, -4, -3, -2, -1, 0, 1, 2, 3, 4),
  NITROGEN(7, "N", "Nitrogen", ElementCategory.DIATOMIC_NONMETAL, -3, -2, -1, 0, 1, 2, 3, 4, 5),
  OXYGEN(8, "O", "Oxygen", ElementCategory.DIATOMIC_NONMETAL, -2, -1, 0, 1, 2),
  FLUORINE(9, "F", "Fluorine", ElementCategory.DIATOMIC_NONMETAL, -1, 0),
  NEON(10, "Ne", "Neon", ElementCategory.NOBLE_GAS, 0),
  SODIUM(11, "Na", "Sodium", ElementCategory.ALKALI_METAL, -1, 0, 1),
  MAGNESIUM(12, "Mg", "Magnesium", ElementCategory.ALKALINE_EARTH_METAL, 0, 1, 2),
  ALUMINIUM(13, "Al", "Aluminium", ElementCategory.POST_TRANSITION_METAL, -2, -1, 0, 1, 2, 3),
  SILICON(14, "Si", "Silicon", ElementCategory.METALLOID, -4, -3, -2, -1, 0, 1, 2, 3, 4),
  PHOSPHORUS(15, "P", "Phosphorus", ElementCategory.POLYATOMIC_NONMETAL, -3, -2, -1, 0, 1, 2, 3, 4, 5),
  SULFUR(16, "S", "Sulfur", ElementCategory.POLYATOMIC_NONMETAL, -2, -1, 0, 1, 2, 3, 4, 5, 6),
  CHLORINE(17, "Cl", "Chlorine", ElementCategory.DIATOMIC_NONMETAL, -1, 0, 1, 2, 3, 4, 5, 6, 7),
  ARGON(18, "Ar", "Argon", ElementCategory.NOBLE_GAS, 0),
  POTASSIUM(19, "K", "Potassium", ElementCategory.ALKALI_METAL, -1, 0, 1),
  CALCIUM(20, "Ca", "Calcium", ElementCategory.ALKALINE_EARTH_METAL, 0, 1, 2),
  IRON(26, "Fe", "Iron", ElementCategory.TRANSITION_METAL, -4, -2, -1, 0, 1, 2, 3, 4, 5, 6, 7),
  COPPER(29, "Cu", "Copper", ElementCategory.TRANSITION_METAL, -2, 0, 1, 2, 3, 4),
  ZINC(30, "Zn", "Zinc", ElementCategory.TRANSITION_METAL, -2, 0, 1, 2),
  BROMINE(35, "Br", "Bromine", ElementCategory.DIATOMIC_NONMETAL, -1, 0, 1, 3, 4, 5, 7),
  KRYPTON(36, "Kr", "Krypton", ElementCategory.NOBLE_GAS, 0, 1, 2),
  SILVER(47, "Ag", "Silver", ElementCategory.TRANSITION_METAL, -2, -1, 0, 1, 2, 3),
  IODINE(53, "I", "Iodine", ElementCategory.DIATOMIC_NONMETAL, -1, 0, 1, 3, 4, 5, 6, 7),
  XENON(54, "Xe", "Xenon", ElementCategory.NOBLE_GAS, 0, 1, 2, 4, 6, 8),
  PROMETHIUM(61, "Pm", "Promethium", ElementCategory.LANTHANIDE, 0, 2, 3),
  SAMARIUM(62, "Sm", "Samarium", ElementCategory.LANTHANIDE, 0, 1, 2, 3),
  EUROPIUM(63, "Eu", "Europium", ElementCategory.LANTHANIDE, 0, 2, 3),
  RADON(86, "Rn", "Radon", ElementCategory.NOBLE_GAS, 0, 2, 6),
  ;

  private Element element;

  CommonElements(int atomicNumber, String symbol, String name, ElementCategory category, Integer... oxidationStates) {
    this.element = new PeriodicElement(atomicNumber, symbol, name, category, Arrays.asList(oxidationStates));
  }

  public Element getElement() {
    return this.element;
  }

  public static List<Element> getAllElements() {
    CommonElements[] values = values();
    Element[] elements = new Element[values.length];
    for (int i = 0; i < values.length; i++) {
      elements[i] = values[i].getElement();
    }
    return Collections.unmodifiableList(Arrays.asList(elements));
  }

  public static Optional<Element> fromSymbol(String symbol) {
    for (CommonElements common : values()) {
      if (common.element.getSymbol().equalsIgnoreCase(symbol)) {
        return Optional.of(common.element);
      }
    }
    return Optional.empty();
  }
}

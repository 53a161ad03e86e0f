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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Enumerates the element categories used by the periodic table data.  Each category serializes to the label the
 * element data files use ("noble gas", "alkali metal", ...).
 */
public enum ElementCategory {
  ALKALI_METAL("alkali metal"),
  ALKALINE_EARTH_METAL("alkaline earth metal"),
  TRANSITION_METAL("transition metal"),
  POST_TRANSITION_METAL("post-transition metal"),
  METALLOID("metalloid"),
  DIATOMIC_NONMETAL("diatomic nonmetal"),
  POLYATOMIC_NONMETAL("polyatomic nonmetal"),
  NOBLE_GAS("noble gas"),
  LANTHANIDE("lanthanide"),
  ACTINIDE("actinide"),
  UNKNOWN("unknown"),
  ;

  private String label;

  ElementCategory(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return this.label;
  }

  /**
   * Maps a category label to its category.  Matching ignores case; anything unrecognized (including null) is UNKNOWN,
   * since new data files sometimes carry categories like "unknown, probably transition metal".
   * @param label The label to look up.
   * @return The matching category, or UNKNOWN.
   */
  @JsonCreator
  public static ElementCategory fromLabel(String label) {
    if (label == null) {
      return UNKNOWN;
    }
    for (ElementCategory category : values()) {
      if (category.label.equalsIgnoreCase(label.trim())) {
        return category;
      }
    }
    return UNKNOWN;
  }
}

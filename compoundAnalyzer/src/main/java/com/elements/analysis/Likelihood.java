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

package com.elements.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The qualitative verdict on whether a set of elements forms a stable compound.
 */
public enum Likelihood {
  // Declared weakest first; ordinal order is used to make sure a verdict is only ever raised.
  UNLIKELY("unlikely"),
  POSSIBLE_BUT_UNSTABLE("possible but unstable"),
  LIKELY("likely"),
  ;

  private String label;

  Likelihood(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public boolean isStrongerThan(Likelihood other) {
    return this.ordinal() > other.ordinal();
  }

  public static Likelihood strongest(Likelihood a, Likelihood b) {
    return b.isStrongerThan(a) ? b : a;
  }
}

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One element's share of a charge-balanced formula: the oxidation state it was given and how many atoms of it there
 * are.
 */
public class OxidationAssignment {

  @JsonProperty("symbol")
  private String symbol;

  @JsonProperty("oxidation_state")
  private int oxidationState;

  @JsonProperty("count")
  private int count;

  public OxidationAssignment(String symbol, int oxidationState, int count) {
    this.symbol = symbol;
    this.oxidationState = oxidationState;
    this.count = count;
  }

  public String getSymbol() {
    return symbol;
  }

  public int getOxidationState() {
    return oxidationState;
  }

  public int getCount() {
    return count;
  }

  @JsonIgnore
  public int getCharge() {
    return oxidationState * count;
  }

  /**
   * Renders an oxidation state with an explicit sign for positive values, like "+2" or "-1".
   */
  public static String formatOxidationState(int oxidationState) {
    return oxidationState > 0 ? "+" + oxidationState : Integer.toString(oxidationState);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    OxidationAssignment that = (OxidationAssignment) o;

    if (oxidationState != that.oxidationState) return false;
    if (count != that.count) return false;
    return symbol.equals(that.symbol);
  }

  @Override
  public int hashCode() {
    int result = symbol.hashCode();
    result = 31 * result + oxidationState;
    result = 31 * result + count;
    return result;
  }

  // Example: "O: -2 (x3)"
  @Override
  public String toString() {
    return String.format("%s: %s (x%d)", symbol, formatOxidationState(oxidationState), count);
  }
}

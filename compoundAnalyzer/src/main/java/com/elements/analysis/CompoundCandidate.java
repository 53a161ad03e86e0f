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
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A proposed formula together with the oxidation states that balance it.  Candidates that were not reached by
 * balancing charges (a user formula that doesn't balance, a formula reported despite missing data) carry an empty
 * assignment.
 */
public class CompoundCandidate {

  @JsonProperty("formula")
  private String formula;

  @JsonProperty("oxidation_assignment")
  private List<OxidationAssignment> oxidationAssignment;

  public CompoundCandidate(String formula, List<OxidationAssignment> oxidationAssignment) {
    this.formula = formula;
    this.oxidationAssignment = Collections.unmodifiableList(new ArrayList<>(oxidationAssignment));
  }

  public static CompoundCandidate unassigned(String formula) {
    return new CompoundCandidate(formula, Collections.emptyList());
  }

  public String getFormula() {
    return formula;
  }

  public List<OxidationAssignment> getOxidationAssignment() {
    return oxidationAssignment;
  }

  @JsonIgnore
  public boolean isAssigned() {
    return !oxidationAssignment.isEmpty();
  }

  @JsonIgnore
  public int getNetCharge() {
    int charge = 0;
    for (OxidationAssignment assignment : oxidationAssignment) {
      charge += assignment.getCharge();
    }
    return charge;
  }

  /**
   * Describes the assignment the way it's shown to users, like "H: +1 (x2), O: -2 (x1)".
   */
  public String describeAssignment() {
    return StringUtils.join(oxidationAssignment, ", ");
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    CompoundCandidate that = (CompoundCandidate) o;

    if (!formula.equals(that.formula)) return false;
    return oxidationAssignment.equals(that.oxidationAssignment);
  }

  @Override
  public int hashCode() {
    int result = formula.hashCode();
    result = 31 * result + oxidationAssignment.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return isAssigned() ? String.format("%s [%s]", formula, describeAssignment()) : formula;
  }
}

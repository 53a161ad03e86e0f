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

import com.elements.formula.CompoundFormula;
import com.elements.periodic.Element;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Small helpers shared by the formula solvers.
 */
final class ChargeBalance {

  private ChargeBalance() {
  }

  static List<Integer> nonZeroOxidationStates(Element element) {
    List<Integer> states = new ArrayList<>();
    if (element.getOxidationStates() != null) {
      for (Integer state : element.getOxidationStates()) {
        if (state != null && state != 0) {
          states.add(state);
        }
      }
    }
    return states;
  }

  static boolean haveOppositeSigns(int a, int b) {
    return (a > 0 && b < 0) || (a < 0 && b > 0);
  }

  /**
   * Smallest atom counts that cancel two opposite oxidation states, e.g. (+3, -2) gives [2, 3].
   */
  static int[] balancedSubscripts(int oxidationStateA, int oxidationStateB) {
    int absA = Math.abs(oxidationStateA);
    int absB = Math.abs(oxidationStateB);
    int gcd = ArithmeticUtils.gcd(absA, absB);
    return new int[] {absB / gcd, absA / gcd};
  }

  /**
   * Builds a candidate from parallel arrays of atom counts and oxidation states.  Elements with a count of zero are
   * left out of both the formula and the assignment.
   * @param elements Elements in ascending atomic number order.
   */
  static CompoundCandidate toCandidate(List<Element> elements, int[] counts, int[] oxidationStates) {
    Map<Element, Integer> elementCounts = new HashMap<>();
    List<OxidationAssignment> assignment = new ArrayList<>();
    for (int i = 0; i < elements.size(); i++) {
      if (counts[i] > 0) {
        elementCounts.put(elements.get(i), counts[i]);
        assignment.add(new OxidationAssignment(elements.get(i).getSymbol(), oxidationStates[i], counts[i]));
      }
    }
    return new CompoundCandidate(new CompoundFormula(elementCounts).toString(), assignment);
  }

  static String symbolString(List<Element> elements) {
    StringBuilder builder = new StringBuilder();
    for (Element element : elements) {
      builder.append(element.getSymbol());
    }
    return builder.toString();
  }
}

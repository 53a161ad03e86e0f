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

package com.elements.formula;

import com.elements.periodic.Element;

import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A chemical formula over element records.  Elements with a count of zero are dropped, so a formula built from a
 * full search assignment only shows the elements it actually uses.
 */
public class CompoundFormula implements ChemicalFormula {

  // The following pattern matches element + count combinations in a formula string.
  private static final Pattern ELEMENT_COUNT_PATTERN = Pattern.compile("([A-Z][a-z]?)(\\d*)");

  private static final Comparator<Element> ATOMIC_NUMBER_ORDER =
      (Element e1, Element e2) -> e1.getAtomicNumber().compareTo(e2.getAtomicNumber());

  private Map<Element, Integer> elementCounts;

  public CompoundFormula(Map<Element, Integer> elementCounts) {
    TreeMap<Element, Integer> sorted = new TreeMap<>(ATOMIC_NUMBER_ORDER);
    for (Map.Entry<Element, Integer> entry : elementCounts.entrySet()) {
      if (entry.getValue() != null && entry.getValue() > 0) {
        sorted.put(entry.getKey(), entry.getValue());
      }
    }
    this.elementCounts = Collections.unmodifiableMap(sorted);
  }

  @Override
  public Map<Element, Integer> getElementCounts() {
    return this.elementCounts;
  }

  @Override
  public Integer getElementCount(Element element) {
    return elementCounts.getOrDefault(element, 0);
  }

  @Override
  public Map<String, Integer> getSymbolCounts() {
    Map<String, Integer> symbolCounts = new LinkedHashMap<>();
    for (Map.Entry<Element, Integer> entry : elementCounts.entrySet()) {
      symbolCounts.merge(entry.getKey().getSymbol(), entry.getValue(), Integer::sum);
    }
    return symbolCounts;
  }

  public int getElementTypeCount() {
    return elementCounts.size();
  }

  /**
   * Converts the formula to its canonical string, ordered by atomic number.
   * For example, the formula (C->1, H->4) is rendered as "H4C", and (Na->1, Cl->1) as "NaCl".
   * @return the formula's string representation
   */
  @Override
  public String toString() {
    StringBuilder builder = new StringBuilder();
    for (Map.Entry<Element, Integer> entry : elementCounts.entrySet()) {
      builder.append(entry.getKey().getSymbol());
      Integer count = entry.getValue();
      if (count > 1) {
        builder.append(count.toString());
      }
    }
    return builder.toString();
  }

  @Override
  public boolean equals(Object chemicalFormula) {
    return (chemicalFormula instanceof ChemicalFormula) &&
        getSymbolCounts().equals(((ChemicalFormula) chemicalFormula).getSymbolCounts());
  }

  @Override
  public int hashCode() {
    return getSymbolCounts().hashCode();
  }

  /**
   * Parses a formula string into counts per element symbol, in any element order.
   * Repeated symbols are summed, so "CH3CH3" and "C2H6" give the same counts.
   * @param formulaString The formula, for example "C8H10N4O2".
   * @return A map of symbol to count.
   */
  public static Map<String, Integer> parseSymbolCounts(String formulaString) {
    Map<String, Integer> symbolCounts = new HashMap<>();
    Matcher matches = ELEMENT_COUNT_PATTERN.matcher(formulaString);
    // Example: in "CaCO3", there will be 3 matches for this pattern, each of which having two groups.
    // First match: "Ca", with group 1 being "Ca" and group 2 being "" (empty string)
    // Second match: "C", group 1 is "C", group 2 is ""
    // Third match: "O3", group 1 is "O" and group 2 is "3"
    while (matches.find()) {
      Integer count = (matches.group(2).equals("")) ? 1 : Integer.parseInt(matches.group(2));
      symbolCounts.merge(matches.group(1), count, Integer::sum);
    }
    return symbolCounts;
  }
}

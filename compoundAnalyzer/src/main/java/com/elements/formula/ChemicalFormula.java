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

import java.util.Map;

/**
 * An interface representing a chemical formula.
 * A Chemical Formula is here represented by its elements counts.
 * For example, CH4 is represented as Map(C -> 1, H -> 4) where C and H are the carbon and hydrogen elements.
 */
public interface ChemicalFormula {
  /**
   * Get the formula's element counts
   */
  Map<Element, Integer> getElementCounts();

  /**
   * Get the number of a given element in the formula
   */
  Integer getElementCount(Element element);

  /**
   * Get the formula's counts keyed by element symbol
   */
  Map<String, Integer> getSymbolCounts();

  /**
   * Converts a formula to its canonical string representation: elements in ascending atomic number order, with
   * counts of 1 left out.
   * @return string representation of the formula
   */
  @Override
  String toString();
}

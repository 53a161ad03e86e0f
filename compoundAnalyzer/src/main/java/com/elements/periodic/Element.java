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

import java.util.List;
import java.util.Optional;

/**
 * An interface representing a chemical element such as C, H or O, as seen by the compound analysis code.
 * Element records are owned by whoever loaded them and are treated as read-only.
 */
public interface Element {

  /**
   * Get the symbol of the element (for example, "C" for carbon)
   */
  String getSymbol();

  /**
   * Get the atomic number (# protons) of the element (for example, 6 for carbon)
   */
  Integer getAtomicNumber();

  /**
   * Get the full name of the element (for example, "Carbon")
   */
  String getName();

  /**
   * Get the category of the element, such as alkali metal or noble gas
   */
  ElementCategory getCategory();

  /**
   * Get the known oxidation states of the element, in the order the data source lists them.
   * May contain 0, and may be empty.
   */
  List<Integer> getOxidationStates();

  /**
   * Get the Pauling electronegativity of the element, if one is known
   */
  Optional<Double> getElectronegativity();
}

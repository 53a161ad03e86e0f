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

import com.elements.periodic.Element;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The outcome of classifying a set of elements by electronegativity difference.  When some element has no
 * electronegativity, the bond type is UNKNOWN, there is no difference, and the elements lacking data are listed.
 */
public class BondClassification {

  private BondType bondType;
  private Double maxDifference;
  private List<Element> missingElectronegativity;

  private BondClassification(BondType bondType, Double maxDifference, List<Element> missingElectronegativity) {
    this.bondType = bondType;
    this.maxDifference = maxDifference;
    this.missingElectronegativity = Collections.unmodifiableList(missingElectronegativity);
  }

  public static BondClassification of(BondType bondType, double maxDifference) {
    return new BondClassification(bondType, maxDifference, Collections.emptyList());
  }

  public static BondClassification insufficientData(List<Element> missingElectronegativity) {
    return new BondClassification(BondType.UNKNOWN, null, missingElectronegativity);
  }

  public BondType getBondType() {
    return bondType;
  }

  public Optional<Double> getMaxDifference() {
    return Optional.ofNullable(maxDifference);
  }

  public List<Element> getMissingElectronegativity() {
    return missingElectronegativity;
  }

  public boolean hasSufficientData() {
    return missingElectronegativity.isEmpty();
  }
}

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
import com.elements.periodic.ElementCategory;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Classifies the dominant bond character of a set of elements from the largest pairwise difference in Pauling
 * electronegativity.
 */
public class BondClassifier {

  // Conventional Pauling-scale cutoffs.
  public static final double IONIC_THRESHOLD = 1.7;
  public static final double POLAR_THRESHOLD = 0.4;

  public BondClassification classify(List<Element> elements) {
    List<Element> missing = new ArrayList<>();
    List<Double> electronegativities = new ArrayList<>(elements.size());
    for (Element element : elements) {
      Optional<Double> electronegativity = element.getElectronegativity();
      if (electronegativity.isPresent()) {
        electronegativities.add(electronegativity.get());
      } else {
        missing.add(element);
      }
    }
    if (!missing.isEmpty()) {
      return BondClassification.insufficientData(missing);
    }

    double maxDifference = 0.0;
    for (int i = 0; i < electronegativities.size() - 1; i++) {
      for (int j = i + 1; j < electronegativities.size(); j++) {
        maxDifference = Math.max(maxDifference, Math.abs(electronegativities.get(i) - electronegativities.get(j)));
      }
    }
    return BondClassification.of(classifyDifference(maxDifference), maxDifference);
  }

  public static BondType classifyDifference(double difference) {
    if (difference > IONIC_THRESHOLD) {
      return BondType.IONIC;
    } else if (difference > POLAR_THRESHOLD) {
      return BondType.POLAR_COVALENT;
    }
    return BondType.NONPOLAR_COVALENT;
  }

  public static List<Element> findNobleGases(List<Element> elements) {
    List<Element> nobleGases = new ArrayList<>();
    for (Element element : elements) {
      if (element.getCategory() == ElementCategory.NOBLE_GAS) {
        nobleGases.add(element);
      }
    }
    return nobleGases;
  }

  /**
   * Explains why the given noble gases won't form a compound.
   * @param nobleGases One or more noble gas elements.
   * @return A sentence naming them, for example "Helium is a noble gas with a complete valence shell ...".
   */
  public static String describeNobleGases(List<Element> nobleGases) {
    boolean plural = nobleGases.size() > 1;
    return String.format("%s %s with a complete valence shell and will not readily form compounds.",
        joinNames(nobleGases), plural ? "are noble gases" : "is a noble gas");
  }

  public static String describeMissingElectronegativity(List<Element> missing) {
    return String.format("Insufficient electronegativity data available for complete analysis (no value for %s).",
        joinNames(missing));
  }

  public static String formatDifference(double difference) {
    return String.format(Locale.US, "%.2f", difference);
  }

  static String joinNames(List<Element> elements) {
    List<String> names = new ArrayList<>(elements.size());
    for (Element element : elements) {
      names.add(element.getName() != null ? element.getName() : element.getSymbol());
    }
    return StringUtils.join(names, ", ");
  }
}

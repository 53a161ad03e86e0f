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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Proposes formulas for a two-element compound by pairing every positive oxidation state of one element with every
 * negative oxidation state of the other and cancelling the charges with the smallest whole-number subscripts.
 */
public class BinaryFormulaSolver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(BinaryFormulaSolver.class);

  public static final double STRONG_IONIC_THRESHOLD = 2.0;

  /**
   * @param first The element with the lower atomic number.
   * @param second The element with the higher atomic number.
   * @param classification The bond classification of the pair; must have electronegativity data.
   * @return The structural analysis, before any known-compound lookup.
   */
  public CompoundAnalysis solve(Element first, Element second, BondClassification classification) {
    List<Element> elements = Arrays.asList(first, second);
    BondType bondType = classification.getBondType();
    double difference = classification.getMaxDifference().orElse(0.0);

    List<Integer> firstStates = ChargeBalance.nonZeroOxidationStates(first);
    List<Integer> secondStates = ChargeBalance.nonZeroOxidationStates(second);
    if (firstStates.isEmpty() || secondStates.isEmpty()) {
      return new CompoundAnalysis(Likelihood.UNLIKELY, bondType, Collections.emptyList(), difference,
          "One or both elements lack non-zero oxidation states needed for compound formation.", elements, false);
    }

    List<CompoundCandidate> candidates = new ArrayList<>();
    for (Integer firstState : firstStates) {
      for (Integer secondState : secondStates) {
        if (!ChargeBalance.haveOppositeSigns(firstState, secondState)) {
          continue;
        }
        int[] subscripts = ChargeBalance.balancedSubscripts(firstState, secondState);
        candidates.add(ChargeBalance.toCandidate(elements, subscripts, new int[] {firstState, secondState}));
      }
    }
    LOGGER.debug("Found %d binary candidates for %s-%s", candidates.size(), first.getSymbol(), second.getSymbol());

    if (candidates.isEmpty()) {
      return new CompoundAnalysis(Likelihood.UNLIKELY, bondType, candidates, difference,
          "Unable to balance charges with available oxidation states.", elements, false);
    }

    String formattedDifference = BondClassifier.formatDifference(difference);
    String rationale;
    if (bondType == BondType.IONIC && difference > STRONG_IONIC_THRESHOLD) {
      rationale = String.format("Strong ionic bonding expected with electronegativity difference of %s. " +
          "Charges balance well.", formattedDifference);
    } else if (bondType == BondType.IONIC) {
      rationale = String.format("Ionic bonding expected with electronegativity difference of %s. " +
          "Stable compound likely.", formattedDifference);
    } else if (bondType == BondType.POLAR_COVALENT) {
      rationale = String.format("Polar covalent bonding with electronegativity difference of %s. " +
          "Stable molecular compound.", formattedDifference);
    } else {
      rationale = String.format("Covalent bonding with electronegativity difference of %s. " +
          "Stable compound expected.", formattedDifference);
    }
    return new CompoundAnalysis(Likelihood.LIKELY, bondType, candidates, difference, rationale, elements, false);
  }
}

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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a set of elements could plausibly form a stable compound.
 *
 * The analysis runs in a fixed order:
 * 1) if the caller chose atom counts, the user's formula is validated and nothing is searched;
 * 2) any noble gas makes a compound unlikely;
 * 3) elements without electronegativity data make the bond type unknown;
 * 4) two elements are balanced in closed form, three or more are searched;
 * 5) known compounds can raise the verdict to likely, never lower it.
 *
 * An analyzer holds no mutable state and can be shared between threads.
 */
public class CompoundAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CompoundAnalyzer.class);

  private BondClassifier bondClassifier;
  private BinaryFormulaSolver binaryFormulaSolver;
  private MultiElementFormulaSearch multiElementFormulaSearch;
  private UserFormulaValidator userFormulaValidator;

  public CompoundAnalyzer() {
    this.bondClassifier = new BondClassifier();
    this.binaryFormulaSolver = new BinaryFormulaSolver();
    this.multiElementFormulaSearch = new MultiElementFormulaSearch();
    this.userFormulaValidator = new UserFormulaValidator(bondClassifier);
  }

  public CompoundAnalysis analyze(List<Element> elements) {
    return analyze(elements, null);
  }

  /**
   * Analyze a set of elements.
   * @param elements Two or more distinct elements, in any order.
   * @param explicitCounts Atom counts chosen by the user, or null/empty to let the analyzer propose formulas.
   * @return The analysis; never null.
   */
  public CompoundAnalysis analyze(List<Element> elements, Map<Element, Integer> explicitCounts) {
    List<Element> sorted = new ArrayList<>(elements);
    sorted.sort((a, b) -> a.getAtomicNumber().compareTo(b.getAtomicNumber()));

    CompoundAnalysis analysis;
    if (explicitCounts != null && !explicitCounts.isEmpty()) {
      analysis = userFormulaValidator.validate(sorted, explicitCounts);
    } else {
      analysis = analyzeStructure(sorted);
    }
    LOGGER.debug("Analysis of %s: %s", analysis.getElementSymbols(), analysis.getLikelihood().getLabel());
    return analysis;
  }

  private CompoundAnalysis analyzeStructure(List<Element> elements) {
    List<Element> nobleGases = BondClassifier.findNobleGases(elements);
    if (!nobleGases.isEmpty()) {
      return new CompoundAnalysis(Likelihood.UNLIKELY, BondType.NONE, Collections.emptyList(), null,
          BondClassifier.describeNobleGases(nobleGases), elements, false);
    }

    BondClassification classification = bondClassifier.classify(elements);
    if (!classification.hasSufficientData()) {
      return new CompoundAnalysis(Likelihood.POSSIBLE_BUT_UNSTABLE, BondType.UNKNOWN,
          Collections.singletonList(CompoundCandidate.unassigned(ChargeBalance.symbolString(elements))), null,
          BondClassifier.describeMissingElectronegativity(classification.getMissingElectronegativity()),
          elements, false);
    }

    if (elements.size() == 2) {
      CompoundAnalysis analysis = binaryFormulaSolver.solve(elements.get(0), elements.get(1), classification);
      return applyKnownBinaryCompound(analysis);
    }
    CompoundAnalysis analysis = multiElementFormulaSearch.search(elements, classification);
    return applyKnownCompound(analysis);
  }

  private CompoundAnalysis applyKnownBinaryCompound(CompoundAnalysis analysis) {
    Element first = analysis.getElements().get(0);
    Element second = analysis.getElements().get(1);
    if (ChargeBalance.nonZeroOxidationStates(first).isEmpty() ||
        ChargeBalance.nonZeroOxidationStates(second).isEmpty()) {
      // Missing oxidation data is reported as is.
      return analysis;
    }

    Optional<String> known = KnownCompounds.lookupPair(first.getSymbol(), second.getSymbol());
    if (!known.isPresent()) {
      known = lookupCandidateFormulas(analysis.getCandidates());
    }
    if (known.isPresent()) {
      LOGGER.debug("%s-%s is a known compound", first.getSymbol(), second.getSymbol());
      return analysis.withKnownCompound(known.get());
    }
    return analysis;
  }

  private CompoundAnalysis applyKnownCompound(CompoundAnalysis analysis) {
    for (CompoundCandidate candidate : analysis.getCandidates()) {
      Optional<String> known = KnownCompounds.lookupFormula(candidate.getFormula());
      if (!known.isPresent() && candidate.getOxidationAssignment().size() == 2) {
        known = KnownCompounds.lookupPair(candidate.getOxidationAssignment().get(0).getSymbol(),
            candidate.getOxidationAssignment().get(1).getSymbol());
      }
      if (known.isPresent()) {
        LOGGER.debug("Candidate %s matches a known compound", candidate.getFormula());
        return analysis.withKnownCompound(known.get());
      }
    }
    return analysis;
  }

  private Optional<String> lookupCandidateFormulas(List<CompoundCandidate> candidates) {
    for (CompoundCandidate candidate : candidates) {
      Optional<String> known = KnownCompounds.lookupFormula(candidate.getFormula());
      if (known.isPresent()) {
        return known;
      }
    }
    return Optional.empty();
  }
}

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

import com.elements.periodic.CommonElements;
import com.elements.periodic.Element;
import com.elements.periodic.ElementCategory;
import com.elements.periodic.PeriodicElement;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class MultiElementFormulaSearchTest {

  private static Element H = CommonElements.HYDROGEN.getElement();
  private static Element Li = CommonElements.LITHIUM.getElement();
  private static Element Be = CommonElements.BERYLLIUM.getElement();
  private static Element C = CommonElements.CARBON.getElement();
  private static Element O = CommonElements.OXYGEN.getElement();
  private static Element F = CommonElements.FLUORINE.getElement();
  private static Element Na = CommonElements.SODIUM.getElement();
  private static Element Mg = CommonElements.MAGNESIUM.getElement();
  private static Element Cl = CommonElements.CHLORINE.getElement();
  private static Element K = CommonElements.POTASSIUM.getElement();

  private BondClassifier classifier = new BondClassifier();
  private MultiElementFormulaSearch search = new MultiElementFormulaSearch();

  private CompoundAnalysis search(Element... elements) {
    List<Element> elementList = Arrays.asList(elements);
    return search.search(elementList, classifier.classify(elementList));
  }

  private static List<String> formulas(CompoundAnalysis analysis) {
    return analysis.getCandidates().stream().map(CompoundCandidate::getFormula).collect(Collectors.toList());
  }

  @Test
  public void testPreferredOxidationState() {
    assertEquals(1, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(-1, 1)));
    assertEquals(1, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(-2, -1, 1, 2)));
    assertEquals(1, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(-4, -3, -2, -1, 1, 2, 3, 4)));
    assertEquals(-1, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(-1)));
    assertEquals(2, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(3, 2)));
    assertEquals(3, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(-3, 3)));
    assertEquals(-2, MultiElementFormulaSearch.preferredOxidationState(Arrays.asList(3, -2)));
  }

  @Test
  public void testPrimarySearchStopsAtFormulaCap() {
    // Preferred states H:+1, F:-1, Cl:+1 admit far more than MAX_FORMULAS neutral combinations.
    CompoundAnalysis analysis = search(H, F, Cl);

    assertEquals(CompoundAnalysis.MAX_SURFACED_CANDIDATES, analysis.getCandidates().size());
    assertEquals("FCl", analysis.getCandidates().get(0).getFormula());
    assertEquals(Arrays.asList(new OxidationAssignment("F", -1, 1), new OxidationAssignment("Cl", 1, 1)),
        analysis.getCandidates().get(0).getOxidationAssignment());
    assertEquals("F12Cl12", analysis.getCandidates().get(11).getFormula());
    assertEquals("HF", analysis.getCandidates().get(12).getFormula());
    assertEquals("HF2Cl", analysis.getCandidates().get(13).getFormula());

    assertEquals(Likelihood.POSSIBLE_BUT_UNSTABLE, analysis.getLikelihood());
    assertEquals(BondType.IONIC, analysis.getBondType());
    assertTrue(analysis.getRationale(), analysis.getRationale().startsWith(
        "Found 50 possible charge-balanced formulas with max electronegativity difference of 1.78."));
  }

  @Test
  public void testEveryCandidateIsChargeBalanced() {
    for (CompoundAnalysis analysis : Arrays.asList(search(H, F, Cl), search(H, C, O), search(Na, Cl, K))) {
      for (CompoundCandidate candidate : analysis.getCandidates()) {
        assertTrue("Candidate " + candidate + " has an assignment", candidate.isAssigned());
        assertEquals("Candidate " + candidate + " should be neutral", 0, candidate.getNetCharge());
        assertTrue("Candidate " + candidate + " uses at least two elements",
            candidate.getOxidationAssignment().size() >= 2);
      }
    }
  }

  @Test
  public void testPairwiseFallbackWhenPreferredStatesShareSign() {
    // H, C and O all prefer +1, so only the pairwise fallback can balance them.
    CompoundAnalysis analysis = search(H, C, O);

    assertEquals(Arrays.asList("HC", "H2C", "H3C", "H4C", "H4C", "H3C", "H2C", "HC", "HO", "H2O"),
        formulas(analysis));
    assertEquals(Arrays.asList(new OxidationAssignment("H", -1, 4), new OxidationAssignment("C", 4, 1)),
        analysis.getCandidates().get(3).getOxidationAssignment());
    assertEquals(Likelihood.POSSIBLE_BUT_UNSTABLE, analysis.getLikelihood());
    assertTrue(analysis.getRationale(), analysis.getRationale().startsWith(
        "Found 10 charge-balanced formulas with primarily covalent character (ΔEN = 1.24)."));
  }

  @Test
  public void testMixedCharacterRationale() {
    CompoundAnalysis analysis = search(Na, Cl, K);

    assertEquals(MultiElementFormulaSearch.MAX_FALLBACK_FORMULAS, analysis.getCandidates().size());
    assertEquals("NaCl", analysis.getCandidates().get(0).getFormula());
    assertEquals("NaK", analysis.getCandidates().get(9).getFormula());
    assertEquals(Likelihood.POSSIBLE_BUT_UNSTABLE, analysis.getLikelihood());
    assertTrue(analysis.getRationale(), analysis.getRationale().startsWith(
        "Found 10 possible formulas with mixed ionic/covalent character (ΔEN = 2.34)."));
  }

  @Test
  public void testNoBalanceIsUnlikely() {
    CompoundAnalysis analysis = search(Li, Be, Mg);

    assertEquals(Likelihood.UNLIKELY, analysis.getLikelihood());
    assertTrue(analysis.getCandidates().isEmpty());
    assertEquals("Unable to find charge-balanced combinations with available oxidation states for 3 elements.",
        analysis.getRationale());
  }

  @Test
  public void testMissingOxidationStatesAreNamed() {
    Element inertBoron = new PeriodicElement(5, "B", "Boron", ElementCategory.METALLOID, Arrays.asList(0));
    CompoundAnalysis analysis = search(Li, inertBoron, O);

    assertEquals(Likelihood.UNLIKELY, analysis.getLikelihood());
    assertTrue(analysis.getCandidates().isEmpty());
    assertEquals("Boron lacks non-zero oxidation states needed for compound formation.", analysis.getRationale());
  }

  @Test
  public void testSmallPrimarySearchIsExhaustive() {
    Element divalentMagnesium = new PeriodicElement(12, "Mg", "Magnesium", ElementCategory.ALKALINE_EARTH_METAL,
        Arrays.asList(2));
    Element trivalentAluminium = new PeriodicElement(13, "Al", "Aluminium", ElementCategory.POST_TRANSITION_METAL,
        Arrays.asList(3));
    Element oxide = new PeriodicElement(8, "O", "Oxygen", ElementCategory.DIATOMIC_NONMETAL, Arrays.asList(-2));

    CompoundAnalysis analysis = search(oxide, divalentMagnesium, trivalentAluminium);

    // The first solutions in search order: no oxygen is impossible, one oxygen needs one magnesium.
    assertEquals("OMg", analysis.getCandidates().get(0).getFormula());
    assertEquals("O2Mg2", analysis.getCandidates().get(1).getFormula());
    for (CompoundCandidate candidate : analysis.getCandidates()) {
      assertEquals(0, candidate.getNetCharge());
    }
  }
}

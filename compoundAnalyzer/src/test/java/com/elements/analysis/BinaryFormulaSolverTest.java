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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class BinaryFormulaSolverTest {

  private static Element H = CommonElements.HYDROGEN.getElement();
  private static Element Li = CommonElements.LITHIUM.getElement();
  private static Element Be = CommonElements.BERYLLIUM.getElement();
  private static Element O = CommonElements.OXYGEN.getElement();
  private static Element Na = CommonElements.SODIUM.getElement();
  private static Element Al = CommonElements.ALUMINIUM.getElement();
  private static Element Cl = CommonElements.CHLORINE.getElement();

  private BondClassifier classifier = new BondClassifier();
  private BinaryFormulaSolver solver = new BinaryFormulaSolver();

  private CompoundAnalysis solve(Element first, Element second) {
    return solver.solve(first, second, classifier.classify(Arrays.asList(first, second)));
  }

  private static List<String> formulas(CompoundAnalysis analysis) {
    return analysis.getCandidates().stream().map(CompoundCandidate::getFormula).collect(Collectors.toList());
  }

  @Test
  public void testHydrogenAndOxygenGiveWater() {
    CompoundAnalysis analysis = solve(H, O);

    // Hydrogen's states are tried in listed order (-1, +1), each against oxygen's opposite-signed states.
    assertEquals(Arrays.asList("HO", "H2O", "H2O", "HO"), formulas(analysis));
    assertFalse("Hydrogen always comes first", formulas(analysis).contains("HO2"));

    CompoundCandidate water = analysis.getCandidates().get(2);
    assertEquals(Arrays.asList(new OxidationAssignment("H", 1, 2), new OxidationAssignment("O", -2, 1)),
        water.getOxidationAssignment());
    assertEquals("H: +1 (x2), O: -2 (x1)", water.describeAssignment());

    assertEquals(Likelihood.LIKELY, analysis.getLikelihood());
    assertEquals(BondType.POLAR_COVALENT, analysis.getBondType());
    assertEquals("Polar covalent bonding with electronegativity difference of 1.24. Stable molecular compound.",
        analysis.getRationale());
  }

  @Test
  public void testSodiumChlorideIsStronglyIonic() {
    CompoundAnalysis analysis = solve(Na, Cl);

    assertEquals(Arrays.asList("NaCl", "Na2Cl", "Na3Cl", "Na4Cl", "Na5Cl", "Na6Cl", "Na7Cl", "NaCl"),
        formulas(analysis));
    assertEquals(BondType.IONIC, analysis.getBondType());
    assertEquals(Likelihood.LIKELY, analysis.getLikelihood());
    assertTrue(analysis.getRationale().startsWith(
        "Strong ionic bonding expected with electronegativity difference of 2.23."));
  }

  @Test
  public void testSubscriptsAreReducedByGcd() {
    CompoundAnalysis analysis = solve(O, Al);

    // Al(+3) with O(-2) gives the familiar corundum stoichiometry, written oxygen first.
    assertTrue(formulas(analysis).contains("O3Al2"));
    for (CompoundCandidate candidate : analysis.getCandidates()) {
      assertEquals("Candidate " + candidate + " should be neutral", 0, candidate.getNetCharge());
    }
  }

  @Test
  public void testSameSignStatesCannotBalance() {
    CompoundAnalysis analysis = solve(Li, Be);

    assertEquals(Likelihood.UNLIKELY, analysis.getLikelihood());
    assertTrue(analysis.getCandidates().isEmpty());
    assertEquals("Unable to balance charges with available oxidation states.", analysis.getRationale());
  }

  @Test
  public void testMissingOxidationStates() {
    Element inertHydrogen = new PeriodicElement(1, "H", "Hydrogen", ElementCategory.DIATOMIC_NONMETAL,
        Arrays.asList(0));
    CompoundAnalysis analysis = solve(inertHydrogen, O);

    assertEquals(Likelihood.UNLIKELY, analysis.getLikelihood());
    assertTrue(analysis.getCandidates().isEmpty());
    assertEquals("One or both elements lack non-zero oxidation states needed for compound formation.",
        analysis.getRationale());
    assertEquals(BondType.POLAR_COVALENT, analysis.getBondType());
  }
}

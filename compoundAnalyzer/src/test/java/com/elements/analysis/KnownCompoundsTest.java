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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class KnownCompoundsTest {

  @Test
  public void testPairLookupIsUnordered() {
    assertTrue(KnownCompounds.lookupPair("H", "O").isPresent());
    assertEquals(KnownCompounds.lookupPair("H", "O"), KnownCompounds.lookupPair("O", "H"));
    assertEquals("Table salt (NaCl) is extremely stable.", KnownCompounds.lookupPair("Cl", "Na").get());
    assertFalse(KnownCompounds.lookupPair("Na", "K").isPresent());
  }

  @Test
  public void testFormulaLookupIgnoresElementOrder() {
    assertEquals("Methane is a stable hydrocarbon.", KnownCompounds.lookupFormula("CH4").get());
    assertEquals("Methane is a stable hydrocarbon.", KnownCompounds.lookupFormula("H4C").get());
    assertEquals("Calcium carbonate (limestone) is very stable.", KnownCompounds.lookupFormula("CO3Ca").get());
    assertEquals("Sulfuric acid is a very stable strong acid.", KnownCompounds.lookupFormula("H2O4S").get());
  }

  @Test
  public void testFormulaLookupNeedsExactCounts() {
    assertTrue(KnownCompounds.lookupFormula("H2O").isPresent());
    assertTrue(KnownCompounds.lookupFormula("H2O2").isPresent());
    assertFalse(KnownCompounds.lookupFormula("HO").isPresent());
    assertFalse(KnownCompounds.lookupFormula("H3O").isPresent());
    assertFalse(KnownCompounds.lookupFormula("CS2").isPresent());
  }
}

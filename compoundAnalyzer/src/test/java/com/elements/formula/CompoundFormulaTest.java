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

import com.elements.periodic.CommonElements;
import com.elements.periodic.Element;
import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

public class CompoundFormulaTest {

  private static Element H = CommonElements.HYDROGEN.getElement();
  private static Element C = CommonElements.CARBON.getElement();
  private static Element O = CommonElements.OXYGEN.getElement();
  private static Element Na = CommonElements.SODIUM.getElement();
  private static Element Cl = CommonElements.CHLORINE.getElement();
  private static Element Ca = CommonElements.CALCIUM.getElement();

  @Test
  public void testFormulaIsOrderedByAtomicNumber() {
    Map<Element, Integer> salt = new HashMap<Element, Integer>() {{
      put(Cl, 1); put(Na, 1);
    }};
    assertEquals("NaCl", new CompoundFormula(salt).toString());

    Map<Element, Integer> methane = new HashMap<Element, Integer>() {{
      put(C, 1); put(H, 4);
    }};
    assertEquals("H4C", new CompoundFormula(methane).toString());

    Map<Element, Integer> limestone = new HashMap<Element, Integer>() {{
      put(Ca, 1); put(C, 1); put(O, 3);
    }};
    assertEquals("CO3Ca", new CompoundFormula(limestone).toString());
  }

  @Test
  public void testZeroCountsAreDropped() {
    Map<Element, Integer> counts = new HashMap<Element, Integer>() {{
      put(H, 2); put(C, 0); put(O, 1);
    }};
    CompoundFormula water = new CompoundFormula(counts);
    assertEquals("H2O", water.toString());
    assertEquals(2, water.getElementTypeCount());
    assertEquals(Integer.valueOf(0), water.getElementCount(C));
    assertEquals(Integer.valueOf(2), water.getElementCount(H));
  }

  @Test
  public void testParseSymbolCounts() {
    Map<String, Integer> expected = new HashMap<String, Integer>() {{
      put("Ca", 1); put("C", 1); put("O", 3);
    }};
    assertEquals(expected, CompoundFormula.parseSymbolCounts("CaCO3"));

    Map<String, Integer> ethane = new HashMap<String, Integer>() {{
      put("C", 2); put("H", 6);
    }};
    assertEquals("Repeated symbols are summed", ethane, CompoundFormula.parseSymbolCounts("CH3CH3"));
    assertEquals(ethane, CompoundFormula.parseSymbolCounts("C2H6"));
  }

  @Test
  public void testFormulasWithSameCountsAreEqual() {
    Map<Element, Integer> first = new HashMap<Element, Integer>() {{
      put(H, 2); put(O, 1);
    }};
    Map<Element, Integer> second = new HashMap<Element, Integer>() {{
      put(O, 1); put(H, 2);
    }};
    Map<Element, Integer> peroxide = new HashMap<Element, Integer>() {{
      put(O, 2); put(H, 2);
    }};
    assertEquals(new CompoundFormula(first), new CompoundFormula(second));
    assertEquals(new CompoundFormula(first).hashCode(), new CompoundFormula(second).hashCode());
    assertNotEquals(new CompoundFormula(first), new CompoundFormula(peroxide));
    assertEquals(CompoundFormula.parseSymbolCounts("H2O"), new CompoundFormula(second).getSymbolCounts());
  }
}

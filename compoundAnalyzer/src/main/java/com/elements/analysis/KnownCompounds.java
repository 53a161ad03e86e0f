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

import com.elements.formula.ChemicalFormula;
import com.elements.formula.CompoundFormula;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Well-known compounds, with a sentence describing each.  Binary compounds are looked up by their unordered pair of
 * element symbols; compounds of any size by their formula.  Formulas are compared by element counts, so a registry
 * entry written in the usual order ("CH4", "CaCO3") matches the atomic-number-ordered rendering ("H4C", "CO3Ca").
 */
public class KnownCompounds {

  private static final Map<String, String> PAIR_DESCRIPTIONS;
  private static final Map<Map<String, Integer>, String> FORMULA_DESCRIPTIONS;

  static {
    Map<String, String> pairs = new HashMap<>();
    addPair(pairs, "H", "O", "Water (H2O) is one of the most stable compounds.");
    addPair(pairs, "H", "Cl", "Hydrochloric acid (HCl) is a very stable compound.");
    addPair(pairs, "Na", "Cl", "Table salt (NaCl) is extremely stable.");
    addPair(pairs, "C", "O", "Carbon dioxide (CO2) and carbon monoxide (CO) are stable.");
    addPair(pairs, "N", "H", "Ammonia (NH3) is a stable compound.");
    addPair(pairs, "Ca", "O", "Calcium oxide (CaO) is a common stable compound.");
    addPair(pairs, "Mg", "O", "Magnesium oxide (MgO) is highly stable.");
    addPair(pairs, "Fe", "O", "Iron oxides (FeO, Fe2O3) are common and stable.");
    addPair(pairs, "Al", "O", "Aluminum oxide (Al2O3) is extremely stable.");
    addPair(pairs, "Si", "O", "Silicon dioxide (SiO2) is very stable - quartz.");
    addPair(pairs, "H", "S", "Hydrogen sulfide (H2S) is a known compound.");
    addPair(pairs, "K", "Cl", "Potassium chloride (KCl) is stable.");
    addPair(pairs, "Ca", "Cl", "Calcium chloride (CaCl2) is stable.");
    PAIR_DESCRIPTIONS = Collections.unmodifiableMap(pairs);

    Map<Map<String, Integer>, String> formulas = new HashMap<>();
    addFormula(formulas, "H2O", "Water is one of the most stable and abundant compounds.");
    addFormula(formulas, "H2O2", "Hydrogen peroxide is a well-known oxidizer.");
    addFormula(formulas, "NaCl", "Table salt is extremely stable.");
    addFormula(formulas, "CO2", "Carbon dioxide is a stable and common gas.");
    addFormula(formulas, "CO", "Carbon monoxide is stable though toxic.");
    addFormula(formulas, "NH3", "Ammonia is a stable and important compound.");
    addFormula(formulas, "CH4", "Methane is a stable hydrocarbon.");
    addFormula(formulas, "C2H6", "Ethane is a stable hydrocarbon.");
    addFormula(formulas, "C3H8", "Propane is a stable fuel.");
    addFormula(formulas, "C6H12O6", "Glucose is a fundamental biological molecule.");
    addFormula(formulas, "H2SO4", "Sulfuric acid is a very stable strong acid.");
    addFormula(formulas, "HCl", "Hydrochloric acid is highly stable.");
    addFormula(formulas, "HNO3", "Nitric acid is a stable strong acid.");
    addFormula(formulas, "CaCO3", "Calcium carbonate (limestone) is very stable.");
    addFormula(formulas, "NaOH", "Sodium hydroxide is a stable strong base.");
    addFormula(formulas, "KOH", "Potassium hydroxide is a stable strong base.");
    addFormula(formulas, "CaO", "Calcium oxide (quicklime) is stable.");
    addFormula(formulas, "MgO", "Magnesium oxide is highly stable.");
    addFormula(formulas, "Al2O3", "Aluminum oxide (corundum) is extremely stable.");
    addFormula(formulas, "SiO2", "Silicon dioxide (quartz) is very stable.");
    addFormula(formulas, "Fe2O3", "Iron(III) oxide (rust) is stable.");
    addFormula(formulas, "FeO", "Iron(II) oxide is a known compound.");
    addFormula(formulas, "CaCl2", "Calcium chloride is stable.");
    addFormula(formulas, "Na2SO4", "Sodium sulfate is stable.");
    addFormula(formulas, "K2CO3", "Potassium carbonate is stable.");
    addFormula(formulas, "C8H10N4O2", "Caffeine - a stable alkaloid compound!");
    FORMULA_DESCRIPTIONS = Collections.unmodifiableMap(formulas);
  }

  private KnownCompounds() {
  }

  private static void addPair(Map<String, String> pairs, String symbol1, String symbol2, String description) {
    pairs.put(pairKey(symbol1, symbol2), description);
  }

  private static void addFormula(Map<Map<String, Integer>, String> formulas, String formula, String description) {
    formulas.put(Collections.unmodifiableMap(CompoundFormula.parseSymbolCounts(formula)), description);
  }

  private static String pairKey(String symbol1, String symbol2) {
    return symbol1.compareTo(symbol2) <= 0 ? symbol1 + "-" + symbol2 : symbol2 + "-" + symbol1;
  }

  /**
   * Look up a well-known binary compound by its two element symbols, in either order.
   */
  public static Optional<String> lookupPair(String symbol1, String symbol2) {
    return Optional.ofNullable(PAIR_DESCRIPTIONS.get(pairKey(symbol1, symbol2)));
  }

  public static Optional<String> lookupFormula(ChemicalFormula formula) {
    return lookupFormula(formula.getSymbolCounts());
  }

  public static Optional<String> lookupFormula(String formula) {
    return lookupFormula(CompoundFormula.parseSymbolCounts(formula));
  }

  public static Optional<String> lookupFormula(Map<String, Integer> symbolCounts) {
    return Optional.ofNullable(FORMULA_DESCRIPTIONS.get(symbolCounts));
  }
}

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An element record as found in the periodic table data files.  Only the fields the compound analysis needs are
 * mapped; everything else in a record (melting point, isotopes, spectral lines, ...) is ignored on read.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PeriodicElement implements Element {

  @JsonProperty("atomicNumber")
  private Integer atomicNumber;

  @JsonProperty("symbol")
  private String symbol;

  @JsonProperty("name")
  private String name;

  @JsonProperty("category")
  private ElementCategory category;

  @JsonProperty("oxidationStates")
  private List<Integer> oxidationStates;

  // Only set when the record carries its own value; otherwise the static table is used.
  @JsonProperty("electronegativity")
  private Double electronegativity;

  @JsonCreator
  public PeriodicElement(@JsonProperty("atomicNumber") Integer atomicNumber,
                         @JsonProperty("symbol") String symbol,
                         @JsonProperty("name") String name,
                         @JsonProperty("category") ElementCategory category,
                         @JsonProperty("oxidationStates") List<Integer> oxidationStates,
                         @JsonProperty("electronegativity") Double electronegativity) {
    this.atomicNumber = atomicNumber;
    this.symbol = symbol;
    this.name = name;
    this.category = category == null ? ElementCategory.UNKNOWN : category;
    this.oxidationStates = oxidationStates == null ?
        Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(oxidationStates));
    this.electronegativity = electronegativity;
  }

  public PeriodicElement(Integer atomicNumber, String symbol, String name, ElementCategory category,
                         List<Integer> oxidationStates) {
    this(atomicNumber, symbol, name, category, oxidationStates, null);
  }

  @Override
  public Integer getAtomicNumber() {
    return this.atomicNumber;
  }

  @Override
  public String getSymbol() {
    return this.symbol;
  }

  @Override
  public String getName() {
    return this.name;
  }

  @Override
  public ElementCategory getCategory() {
    return this.category;
  }

  @Override
  public List<Integer> getOxidationStates() {
    return this.oxidationStates;
  }

  @JsonIgnore
  @Override
  public Optional<Double> getElectronegativity() {
    if (this.electronegativity != null) {
      return Optional.of(this.electronegativity);
    }
    return ElectronegativityTable.getElectronegativity(this.atomicNumber);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    PeriodicElement that = (PeriodicElement) o;

    if (!symbol.equals(that.symbol)) return false;
    return atomicNumber.equals(that.atomicNumber);
  }

  @Override
  public int hashCode() {
    int result = symbol.hashCode();
    result = 31 * result + atomicNumber.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return String.format("%s (%d)", this.symbol, this.atomicNumber);
  }
}

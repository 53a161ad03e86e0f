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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A read-only collection of element records, indexed by atomic number and by symbol.
 * Records are kept in ascending atomic number order.
 */
public class ElementCorpus {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ElementCorpus.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private static final TypeReference<List<PeriodicElement>> ELEMENT_LIST_TYPE =
      new TypeReference<List<PeriodicElement>>() {};

  private List<Element> elements;
  private Map<Integer, Element> elementsByAtomicNumber = new HashMap<>();
  private Map<String, Element> elementsBySymbol = new HashMap<>();

  public ElementCorpus(List<? extends Element> elements) {
    List<Element> sorted = new ArrayList<>(elements.size());
    for (Element element : elements) {
      if (element.getAtomicNumber() == null || element.getSymbol() == null) {
        throw new IllegalArgumentException(
            String.format("Element record '%s' is missing its atomic number or symbol", element.getName()));
      }
      if (elementsByAtomicNumber.containsKey(element.getAtomicNumber())) {
        LOGGER.warn("Duplicate record for atomic number %d, keeping the first one", element.getAtomicNumber());
        continue;
      }
      elementsByAtomicNumber.put(element.getAtomicNumber(), element);
      elementsBySymbol.put(element.getSymbol().toLowerCase(Locale.ROOT), element);
      sorted.add(element);
    }
    sorted.sort((a, b) -> a.getAtomicNumber().compareTo(b.getAtomicNumber()));
    this.elements = Collections.unmodifiableList(sorted);
  }

  /**
   * Read a corpus from a JSON array of element records.
   * @param elementsFile The file to read.
   * @return The loaded corpus.
   * @throws IOException If the file can't be read or parsed.
   */
  public static ElementCorpus readFromJsonFile(File elementsFile) throws IOException {
    List<PeriodicElement> records = OBJECT_MAPPER.readValue(elementsFile, ELEMENT_LIST_TYPE);
    LOGGER.info("Loaded %d elements from %s", records.size(), elementsFile.getAbsolutePath());
    return new ElementCorpus(records);
  }

  public static ElementCorpus readFromJsonStream(InputStream stream) throws IOException {
    List<PeriodicElement> records = OBJECT_MAPPER.readValue(stream, ELEMENT_LIST_TYPE);
    LOGGER.info("Loaded %d elements from stream", records.size());
    return new ElementCorpus(records);
  }

  public static ElementCorpus fromCommonElements() {
    return new ElementCorpus(CommonElements.getAllElements());
  }

  public List<Element> getElements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  public Optional<Element> getElementByAtomicNumber(Integer atomicNumber) {
    return Optional.ofNullable(elementsByAtomicNumber.get(atomicNumber));
  }

  public Optional<Element> getElementBySymbol(String symbol) {
    if (symbol == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(elementsBySymbol.get(symbol.trim().toLowerCase(Locale.ROOT)));
  }

  /**
   * Find all elements whose name, symbol or atomic number contains the query, ignoring case.
   * @param query The text to look for.
   * @return Matching elements in atomic number order; empty for a blank query.
   */
  public List<Element> search(String query) {
    if (query == null || query.trim().isEmpty()) {
      return Collections.emptyList();
    }
    String needle = query.trim().toLowerCase(Locale.ROOT);
    List<Element> results = new ArrayList<>();
    for (Element element : elements) {
      if ((element.getName() != null && element.getName().toLowerCase(Locale.ROOT).contains(needle)) ||
          element.getSymbol().toLowerCase(Locale.ROOT).contains(needle) ||
          element.getAtomicNumber().toString().contains(needle)) {
        results.add(element);
      }
    }
    return results;
  }

  /**
   * Count the elements in each category.  Categories with no elements are left out.
   */
  public Map<ElementCategory, Integer> getCategoryCounts() {
    Map<ElementCategory, Integer> counts = new EnumMap<>(ElementCategory.class);
    for (Element element : elements) {
      counts.merge(element.getCategory(), 1, Integer::sum);
    }
    return counts;
  }
}

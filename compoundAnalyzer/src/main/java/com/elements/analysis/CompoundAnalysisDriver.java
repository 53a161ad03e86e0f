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

import com.elements.jobs.FileChecker;
import com.elements.periodic.Element;
import com.elements.periodic.ElementCorpus;
import com.elements.utils.CLIUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public class CompoundAnalysisDriver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CompoundAnalysisDriver.class);

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  private static final String OPTION_ELEMENTS = "e";
  private static final String OPTION_COUNTS = "n";
  private static final String OPTION_ELEMENT_DATA = "i";
  private static final String OPTION_OUTPUT_PATH = "o";
  private static final String OPTION_SEARCH = "q";

  public static final String HELP_MESSAGE =
      "This class analyzes whether a set of elements is likely to form a stable compound, and proposes " +
          "charge-balanced formulas for it.";

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {
    {
      add(Option.builder(OPTION_ELEMENTS)
          .argName("element symbols")
          .desc("A comma separated list of at least two element symbols, e.g. Na,Cl")
          .hasArg()
          .longOpt("elements")
          .required(true)
      );
      add(Option.builder(OPTION_COUNTS)
          .argName("atom counts")
          .desc("Comma separated atom counts for a specific formula, e.g. C:1,H:4")
          .hasArg()
          .longOpt("counts")
      );
      add(Option.builder(OPTION_ELEMENT_DATA)
          .argName("element data path")
          .desc("A JSON file of element records; defaults to a built-in set of common elements")
          .hasArg()
          .longOpt("input-elements")
      );
      add(Option.builder(OPTION_OUTPUT_PATH)
          .argName("output path")
          .desc("The path to which to write the analysis as JSON; defaults to standard out")
          .hasArg()
          .longOpt("output-path")
      );
      add(Option.builder(OPTION_SEARCH)
          .argName("search query")
          .desc("Log the elements whose name, symbol or atomic number match this query")
          .hasArg()
          .longOpt("search")
      );
    }
  };

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(CompoundAnalysisDriver.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    ElementCorpus corpus;
    if (cl.hasOption(OPTION_ELEMENT_DATA)) {
      File elementsFile = new File(cl.getOptionValue(OPTION_ELEMENT_DATA));
      FileChecker.verifyInputFile(elementsFile);
      corpus = ElementCorpus.readFromJsonFile(elementsFile);
    } else {
      corpus = ElementCorpus.fromCommonElements();
      LOGGER.info("No element data file given, using %d built-in elements", corpus.size());
    }

    if (cl.hasOption(OPTION_SEARCH)) {
      List<Element> matches = corpus.search(cl.getOptionValue(OPTION_SEARCH));
      LOGGER.info("Search for '%s' matched %d elements: %s", cl.getOptionValue(OPTION_SEARCH), matches.size(),
          StringUtils.join(matches, ", "));
    }

    List<Element> elements = null;
    Map<Element, Integer> counts = null;
    try {
      elements = resolveElements(corpus, cl.getOptionValue(OPTION_ELEMENTS));
      if (cl.hasOption(OPTION_COUNTS)) {
        counts = parseCounts(elements, cl.getOptionValue(OPTION_COUNTS));
      }
    } catch (IllegalArgumentException e) {
      cliUtil.failWithMessage("Invalid arguments: %s", e.getMessage());
    }

    CompoundAnalysis analysis = new CompoundAnalyzer().analyze(elements, counts);
    LOGGER.info("%s", analysis);

    if (cl.hasOption(OPTION_OUTPUT_PATH)) {
      File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT_PATH));
      writeAnalysis(analysis, outputFile);
      LOGGER.info("Wrote analysis to %s", outputFile.getAbsolutePath());
    } else {
      System.out.println(OBJECT_MAPPER.writeValueAsString(analysis));
    }
  }

  /**
   * Resolve a comma separated list of symbols against the corpus.  Repeated symbols are collapsed.
   * @throws IllegalArgumentException if a symbol is unknown or fewer than two distinct elements remain.
   */
  public static List<Element> resolveElements(ElementCorpus corpus, String symbolList) {
    Set<Element> elements = new LinkedHashSet<>();
    for (String symbol : StringUtils.split(symbolList, ',')) {
      if (StringUtils.isBlank(symbol)) {
        continue;
      }
      Optional<Element> element = corpus.getElementBySymbol(symbol);
      if (!element.isPresent()) {
        throw new IllegalArgumentException(String.format("Unknown element symbol '%s'", symbol.trim()));
      }
      elements.add(element.get());
    }
    if (elements.size() < 2) {
      throw new IllegalArgumentException("At least two distinct elements are needed to build a compound");
    }
    return new ArrayList<>(elements);
  }

  /**
   * Parse counts like "C:1,H:4" for the given elements.
   * @throws IllegalArgumentException on malformed or non-positive counts, or symbols not among the elements.
   */
  public static Map<Element, Integer> parseCounts(List<Element> elements, String countList) {
    Map<String, Element> bySymbol = new HashMap<>();
    for (Element element : elements) {
      bySymbol.put(element.getSymbol().toLowerCase(), element);
    }

    Map<Element, Integer> counts = new HashMap<>();
    for (String entry : StringUtils.split(countList, ',')) {
      String[] fields = StringUtils.split(entry, ':');
      if (fields.length != 2) {
        throw new IllegalArgumentException(String.format("Expected Symbol:count, got '%s'", entry.trim()));
      }
      Element element = bySymbol.get(fields[0].trim().toLowerCase());
      if (element == null) {
        throw new IllegalArgumentException(
            String.format("Count given for '%s', which is not one of the selected elements", fields[0].trim()));
      }
      int count;
      try {
        count = Integer.parseInt(fields[1].trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(String.format("Count '%s' is not a number", fields[1].trim()), e);
      }
      if (count < 1) {
        throw new IllegalArgumentException(String.format("Count for %s must be positive", element.getSymbol()));
      }
      counts.put(element, count);
    }
    return counts;
  }

  public static void writeAnalysis(CompoundAnalysis analysis, File outputFile) throws IOException {
    FileChecker.verifyAndCreateOutputFile(outputFile);
    OBJECT_MAPPER.writeValue(outputFile, analysis);
  }
}

package edu.jhu.hlt.tb2ud.experiment;

import java.io.File;
import java.io.IOException;

import org.apache.log4j.Logger;

import edu.jhu.hlt.tb2ud.construction.AgldtConstructionClassifier;
import edu.jhu.hlt.tb2ud.construction.BottomUpScheduler;
import edu.jhu.hlt.tb2ud.convert.ArtificialNodeResolver;
import edu.jhu.hlt.tb2ud.convert.ConversionReport;
import edu.jhu.hlt.tb2ud.convert.SubtreeConverter;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;
import edu.jhu.hlt.tb2ud.io.ConlluReader;
import edu.jhu.hlt.tb2ud.io.ConlluWriter;
import edu.jhu.hlt.tb2ud.util.ExperimentProperties;

/**
 * Reads shallow-converted AGLDT trees in CoNLL-U, re-draws their subtrees in
 * UD shape, and writes them back out.
 *
 * Usage: ConvertTreebank input in.conllu output out.conllu [withEnhanced true]
 *   [copulaLemmas εἰμί,sum] [renumber true]
 *
 * @author travis
 */
public class ConvertTreebank {
  public static final Logger LOG = Logger.getLogger(ConvertTreebank.class);

  private final SubtreeConverter converter;
  private final boolean renumber;

  public ConvertTreebank(ExperimentProperties config) {
    boolean withEnhanced = config.getBoolean("withEnhanced", false);
    AgldtConstructionClassifier classifier = new AgldtConstructionClassifier(
        config.getList("copulaLemmas", "εἰμί,sum"));
    this.converter = new SubtreeConverter(withEnhanced, classifier, new BottomUpScheduler());
    this.renumber = config.getBoolean("renumber", true);
    LOG.info("[ConvertTreebank] copula lemmas: " + classifier.getCopulaLemmas());
  }

  public SubtreeConverter getConverter() {
    return converter;
  }

  public DepTree convert(DepTree tree, ConversionReport report) {
    converter.process(tree, report);
    if (renumber) {
      ArtificialNodeResolver.clearRecordedStructure(tree);
      tree.renumber();
    }
    return tree;
  }

  public ConversionReport convert(File input, File output) throws IOException {
    LOG.info("[convert] " + input.getPath() + " => " + output.getPath()
        + " withEnhanced=" + converter.isWithEnhanced() + " renumber=" + renumber);
    ConversionReport report = new ConversionReport();
    try (ConlluReader r = new ConlluReader(input);
        ConlluWriter w = new ConlluWriter(output)) {
      while (r.hasNext()) {
        w.write(convert(r.next(), report));
        if (report.getSentences() % 1000 == 0)
          LOG.info("[convert] " + report.getSentences() + " sentences");
      }
    }
    LOG.info("[convert] done: " + report);
    return report;
  }

  public static void main(String[] args) throws IOException {
    ExperimentProperties config = ExperimentProperties.init(args);
    File input = config.getExistingFile("input");
    File output = config.getFile("output");
    ConvertTreebank ct = new ConvertTreebank(config);
    LOG.info("[main] config: " + config);
    ct.convert(input, output);
  }
}

package edu.jhu.hlt.tb2ud.experiment;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import edu.jhu.hlt.tb2ud.construction.Construction;
import edu.jhu.hlt.tb2ud.convert.ConversionReport;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;
import edu.jhu.hlt.tb2ud.datatypes.Ordinal;
import edu.jhu.hlt.tb2ud.io.ConlluReader;
import edu.jhu.hlt.tb2ud.util.ExperimentProperties;

public class ConvertTreebankTest {

  @Rule
  public TemporaryFolder tmp = new TemporaryFolder();

  private static final String INPUT =
      "# sent_id = caes-1\n"
      + "1\tin\tin\tADP\tr--------\t_\t2\tobl\t_\toriginal_dep=AuxP\n"
      + "2\t[0]\t_\tCCONJ\tc--------\t_\t5\tobl\t_\tNodeType=Artificial|original_dep=COORD\n"
      + "3\tGalliam\tGallia\tPROPN\tn-s---fa-\t_\t2\tobl\t_\toriginal_dep=ADV_CO|CoordMember=True\n"
      + "4\tItaliam\tItalia\tPROPN\tn-s---fa-\t_\t2\tobl\t_\toriginal_dep=ADV_CO|CoordMember=True\n"
      + "5\tvenit\tvenio\tVERB\tv3sria---\t_\t0\troot\t_\toriginal_dep=PRED\n"
      + "\n";

  @Test
  public void convertsAFile() throws IOException {
    File in = tmp.newFile("in.conllu");
    File out = new File(tmp.getRoot(), "out.conllu");
    Files.write(in.toPath(), INPUT.getBytes(StandardCharsets.UTF_8));

    ExperimentProperties config = ExperimentProperties.init(new String[] {
        "input", in.getPath(), "output", out.getPath(), "withEnhanced", "true"});
    ConvertTreebank ct = new ConvertTreebank(config);
    assertTrue(ct.getConverter().isWithEnhanced());
    ConversionReport r = ct.convert(config.getExistingFile("input"), config.getFile("output"));
    assertEquals(1, r.getSentences());
    assertEquals(1, r.count(Construction.COORDINATION));

    List<DepTree> trees;
    try (ConlluReader reader = new ConlluReader(out)) {
      trees = reader.readAll();
    }
    assertEquals(1, trees.size());
    DepTree t = trees.get(0);
    t.checkInvariants();
    // artificial coordinator deleted, tokens renumbered
    assertEquals(4, t.size());
    assertEquals("Galliam", t.findNode(Ordinal.of(2)).getForm());
    assertEquals("venit", t.findNode(Ordinal.of(4)).getForm());
    assertTrue(t.findNode(Ordinal.of(4)).getParent().isRoot());
    assertEquals(Ordinal.of(4), t.findNode(Ordinal.of(2)).getParent().getOrdinal());
  }

  @Test
  public void renumberCanBeTurnedOff() throws IOException {
    ExperimentProperties config = ExperimentProperties.init(new String[] {"renumber", "false"});
    ConvertTreebank ct = new ConvertTreebank(config);
    assertFalse(ct.getConverter().isWithEnhanced());
    DepTree t;
    try (ConlluReader reader = new ConlluReader(new StringReader(INPUT))) {
      t = reader.next();
    }
    ct.convert(t, new ConversionReport());
    // ordinal 2 is left free where the coordinator was
    assertNull(t.findNode(Ordinal.of(2)));
    assertEquals(4, t.size());
  }

  @Test
  public void renumberedOutputHasNoRecordedOrdinals() throws IOException {
    File in = tmp.newFile("elided.conllu");
    File out = new File(tmp.getRoot(), "elided.out.conllu");
    Files.write(in.toPath(), (
        "1\tMarcus\tMarcus\tPROPN\tn-s---mn-\t_\t3\tnsubj\t_\toriginal_dep=SBJ\n"
        + "2\tRomam\tRoma\tPROPN\tn-s---fa-\t_\t3\tobl\t_\toriginal_dep=ADV\n"
        + "3\t[0]\tire\tVERB\tv--------\t_\t0\troot\t_\tNodeType=Artificial|original_dep=PRED\n"
        + "\n").getBytes(StandardCharsets.UTF_8));

    ConvertTreebank ct = new ConvertTreebank(ExperimentProperties.init(new String[] {"withEnhanced", "true"}));
    ConversionReport r = ct.convert(in, out);
    assertEquals(1, r.getEmptyNodesCreated());

    String text = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
    assertFalse(text, text.contains("ArtDeps="));
    assertFalse(text, text.contains("OriginalOrd="));
    assertTrue(text, text.contains("2.1\tE2.1\t"));
    assertTrue(text, text.contains("\t2.1:nsubj\t"));

    // reading it back adds nothing stale
    try (ConlluReader reader = new ConlluReader(out)) {
      DepTree t = reader.next();
      assertNull(t.findNode(Ordinal.of(1)).getRecordedEdge());
      assertNull(t.findEmptyNode(Ordinal.parse("2.1")).getOriginalOrdinal());
    }
  }
}

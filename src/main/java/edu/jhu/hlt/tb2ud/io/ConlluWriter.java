package edu.jhu.hlt.tb2ud.io;

import java.io.BufferedWriter;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import com.google.common.base.Joiner;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;
import edu.jhu.hlt.tb2ud.datatypes.SecondaryEdge;

/**
 * Writes {@link DepTree}s as CoNLL-U. Empty nodes go right after the token
 * they follow and enhanced edges go in the DEPS column.
 *
 * @author travis
 */
public class ConlluWriter implements AutoCloseable {

  private static final Joiner TAB = Joiner.on('\t');

  private final BufferedWriter writer;
  private int sentencesWritten = 0;

  public ConlluWriter(File f) throws IOException {
    this(openWriter(f));
  }

  public ConlluWriter(Writer w) {
    this.writer = w instanceof BufferedWriter ? (BufferedWriter) w : new BufferedWriter(w);
  }

  private static Writer openWriter(File f) throws IOException {
    OutputStream os = new FileOutputStream(f);
    if (f.getName().endsWith(".gz"))
      os = new GZIPOutputStream(os);
    return new OutputStreamWriter(os, StandardCharsets.UTF_8);
  }

  public void write(DepTree tree) throws IOException {
    for (String c : tree.getComments()) {
      writer.write("# " + c);
      writer.newLine();
    }
    List<DepNode> empties = tree.getEmptyNodes();
    int e = 0;
    for (; e < empties.size() && empties.get(e).getOrdinal().getWord() == 0; e++)
      writeLine(empties.get(e));
    for (DepNode n : tree.getDescendants()) {
      writeLine(n);
      int w = n.getOrdinal().getWord();
      for (; e < empties.size() && empties.get(e).getOrdinal().getWord() <= w; e++)
        writeLine(empties.get(e));
    }
    for (; e < empties.size(); e++)
      writeLine(empties.get(e));
    writer.newLine();
    sentencesWritten++;
  }

  private void writeLine(DepNode n) throws IOException {
    String head = "_", deprel = "_";
    if (!n.isEmpty()) {
      head = n.getParent().getOrdinal().toString();
      deprel = field(n.getDeprel());
    }
    writer.write(TAB.join(
        n.getOrdinal(),
        field(n.getForm()),
        field(n.getLemma()),
        field(n.getUpos()),
        field(n.getXpos()),
        field(n.getFeats()),
        head,
        deprel,
        deps(n),
        MiscCodec.encode(n)));
    writer.newLine();
  }

  static String deps(DepNode n) {
    if (n.getDeps().isEmpty())
      return "_";
    List<SecondaryEdge> edges = new ArrayList<>(n.getDeps());
    edges.sort(Comparator.comparing((SecondaryEdge d) -> d.getGovernor().getOrdinal())
        .thenComparing(SecondaryEdge::getRelation));
    return Joiner.on('|').join(edges);
  }

  private static String field(String s) {
    return s == null ? "_" : s;
  }

  public int getSentencesWritten() {
    return sentencesWritten;
  }

  public void flush() throws IOException {
    writer.flush();
  }

  @Override
  public void close() throws IOException {
    writer.close();
  }
}

package edu.jhu.hlt.tb2ud.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.zip.GZIPInputStream;

import org.apache.log4j.Logger;

import com.google.common.base.Splitter;

import edu.jhu.hlt.tb2ud.datatypes.DepNode;
import edu.jhu.hlt.tb2ud.datatypes.DepTree;
import edu.jhu.hlt.tb2ud.datatypes.Ordinal;

/**
 * Reads CoNLL-U sentences (blank line separated) into {@link DepTree}s, one at
 * a time. Files ending in .gz are decompressed.
 *
 * Multi-word token lines (e.g. "3-4") are not supported and are skipped.
 *
 * @author travis
 */
public class ConlluReader implements Iterator<DepTree>, AutoCloseable {
  public static final Logger LOG = Logger.getLogger(ConlluReader.class);

  private static final Splitter TAB = Splitter.on('\t');

  private final BufferedReader reader;
  private int sentencesRead = 0;
  private int lineNo = 0;
  private DepTree next;

  public ConlluReader(File f) throws IOException {
    this(openReader(f));
  }

  /**
   * Reads the first sentence right away. If that fails, r is closed.
   */
  public ConlluReader(Reader r) throws IOException {
    this.reader = r instanceof BufferedReader ? (BufferedReader) r : new BufferedReader(r);
    try {
      this.next = readATree();
    } catch (IOException | RuntimeException e) {
      reader.close();
      throw e;
    }
  }

  private static Reader openReader(File f) throws IOException {
    InputStream is = new FileInputStream(f);
    try {
      if (f.getName().endsWith(".gz"))
        is = new GZIPInputStream(is);
    } catch (IOException e) {
      is.close();
      throw e;
    }
    return new InputStreamReader(is, StandardCharsets.UTF_8);
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public DepTree next() {
    if (next == null)
      throw new NoSuchElementException();
    DepTree r = next;
    try {
      next = readATree();
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    return r;
  }

  public List<DepTree> readAll() {
    List<DepTree> all = new ArrayList<>();
    while (hasNext())
      all.add(next());
    return all;
  }

  /**
   * @return the next sentence or null if there are no more
   */
  public DepTree readATree() throws IOException {
    List<String> comments = new ArrayList<>();
    List<String[]> rows = new ArrayList<>();
    int firstLine = -1;
    for (String line = reader.readLine(); line != null; line = reader.readLine()) {
      lineNo++;
      if (line.trim().isEmpty()) {
        if (comments.isEmpty() && rows.isEmpty())
          continue;   // extra blank lines between sentences
        break;
      }
      if (firstLine < 0)
        firstLine = lineNo;
      if (line.startsWith("#")) {
        String c = line.substring(1);
        comments.add(c.startsWith(" ") ? c.substring(1) : c);
        continue;
      }
      List<String> cols = TAB.splitToList(line);
      if (cols.size() != 10)
        throw new IllegalArgumentException("line " + lineNo + ": expected 10 columns but got " + cols.size());
      if (cols.get(0).contains("-")) {
        LOG.warn("[readATree] skipping multi-word token line " + lineNo + ": " + cols.get(0));
        continue;
      }
      rows.add(cols.toArray(new String[0]));
    }
    if (comments.isEmpty() && rows.isEmpty())
      return null;
    sentencesRead++;
    return buildTree(comments, rows, firstLine);
  }

  private DepTree buildTree(List<String> comments, List<String[]> rows, int firstLine) {
    String id = null;
    for (String c : comments) {
      if (c.startsWith("sent_id")) {
        int eq = c.indexOf('=');
        if (eq >= 0)
          id = c.substring(eq + 1).trim();
      }
    }
    if (id == null)
      id = "s" + sentencesRead;
    DepTree tree = new DepTree(id);
    tree.getComments().addAll(comments);

    // create all the nodes first, heads may point forward
    List<DepNode> nodes = new ArrayList<>();
    for (String[] r : rows) {
      Ordinal ord = Ordinal.parse(r[0]);
      DepNode n = ord.isEmptyNode() ? tree.createEmptyNode(ord) : tree.addNode(ord);
      n.setForm(r[1]);
      n.setLemma(field(r[2]));
      n.setUpos(field(r[3]));
      n.setXpos(field(r[4]));
      n.setFeats(field(r[5]));
      n.setDeprel(field(r[7]));
      MiscCodec.decode(r[9], n);
      nodes.add(n);
    }
    for (int i = 0; i < rows.size(); i++) {
      String[] r = rows.get(i);
      DepNode n = nodes.get(i);
      if (!n.isEmpty()) {
        String h = field(r[6]);
        if (h == null)
          throw new IllegalArgumentException("sentence at line " + firstLine + ": no head for " + r[0]);
        DepNode head = tree.findNode(Ordinal.parse(h));
        if (head == null)
          throw new IllegalArgumentException("sentence at line " + firstLine + ": unknown head " + h + " for " + r[0]);
        n.setParent(head);
      }
      readDeps(field(r[8]), n, tree);
    }
    return tree;
  }

  private static void readDeps(String deps, DepNode n, DepTree tree) {
    if (deps == null)
      return;
    for (String d : Splitter.on('|').omitEmptyStrings().split(deps)) {
      int colon = d.indexOf(':');
      if (colon < 0) {
        LOG.warn("[readDeps] malformed deps item \"" + d + "\" at " + n.address());
        continue;
      }
      Ordinal h = Ordinal.parse(d.substring(0, colon));
      DepNode gov = h.isEmptyNode() ? tree.findEmptyNode(h) : tree.findNode(h);
      if (gov == null) {
        LOG.warn("[readDeps] unknown head " + h + " in deps of " + n.address());
        continue;
      }
      n.addDep(gov, d.substring(colon + 1));
    }
  }

  private static String field(String s) {
    return "_".equals(s) ? null : s;
  }

  public int getSentencesRead() {
    return sentencesRead;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}

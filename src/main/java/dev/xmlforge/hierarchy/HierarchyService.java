package dev.xmlforge.hierarchy;

import dev.xmlforge.tree.XmlNode;
import dev.xmlforge.tree.XmlTreeReader;
import dev.xmlforge.tree.XmlTreeWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * File-level flatten and rebuild.
 *
 * <p>A flattened sequence is stored as one document whose root is a container element (default
 * {@code flattened}) holding the sequence in order. Rebuilding reads such a document and writes
 * the rebuilt tree under the synthetic root.
 */
@Service
public class HierarchyService {

  private static final Logger log = LoggerFactory.getLogger(HierarchyService.class);

  private final XmlTreeReader treeReader;
  private final XmlTreeWriter treeWriter;
  private final HierarchyLinearizer linearizer;
  private final HierarchyRebuilder rebuilder;
  private final HierarchyProperties properties;

  public HierarchyService(
      XmlTreeReader treeReader,
      XmlTreeWriter treeWriter,
      HierarchyLinearizer linearizer,
      HierarchyRebuilder rebuilder,
      HierarchyProperties properties) {
    this.treeReader = treeReader;
    this.treeWriter = treeWriter;
    this.linearizer = linearizer;
    this.rebuilder = rebuilder;
    this.properties = properties;
  }

  /** Options for {@code matchTag} with the configured defaults. */
  public HierarchyOptions defaultOptions(String matchTag) {
    return properties.toOptions(matchTag);
  }

  public FlattenResult flatten(XmlNode root, HierarchyOptions options) {
    return linearizer.flatten(root, options);
  }

  public XmlNode rebuild(List<XmlNode> nodes, HierarchyOptions options) {
    return rebuilder.rebuild(nodes, options);
  }

  /**
   * Flattens a document and writes the sequence to {@code output}.
   *
   * @return the flattened sequence, now held by the written container
   */
  public FlattenResult flattenFile(Path input, Path output, HierarchyOptions options) {
    XmlNode root = treeReader.read(input);
    FlattenResult result = linearizer.flatten(root, options);

    XmlNode container = new XmlNode(properties.containerTag());
    for (XmlNode node : result.nodes()) {
      container.append(node);
    }
    write(container, output);
    log.info(
        "Flattened {} on <{}> into {} nodes, written to {}",
        input,
        options.matchTag(),
        result.size(),
        output);
    return result;
  }

  /**
   * Rebuilds the sequence stored in {@code input} and writes the tree to {@code output}. The
   * children of the input's root element are the sequence.
   */
  public XmlNode rebuildFile(Path input, Path output, HierarchyOptions options) {
    XmlNode container = treeReader.read(input);
    List<XmlNode> sequence = new ArrayList<>(container.getChildren());
    XmlNode root = rebuilder.rebuild(sequence, options);
    write(root, output);
    log.info(
        "Rebuilt {} nodes from {} into {} top-level <{}> elements, written to {}",
        sequence.size(),
        input,
        root.childCount(),
        options.matchTag(),
        output);
    return root;
  }

  private void write(XmlNode node, Path output) {
    Path parent = output.toAbsolutePath().getParent();
    if (parent != null) {
      try {
        Files.createDirectories(parent);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to create " + parent, e);
      }
    }
    treeWriter.write(node, output);
  }
}

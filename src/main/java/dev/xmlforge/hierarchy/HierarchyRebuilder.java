package dev.xmlforge.hierarchy;

import dev.xmlforge.exception.StructuralException;
import dev.xmlforge.tree.XmlNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reassembles a flattened sequence into a nested tree.
 *
 * <p>Nodes whose parent identity resolves are appended to that parent in sequence order.
 * Self-nesting nodes without a parent identity are top-level and go under one synthetic root.
 * Nodes are re-parented in place: the input sequence is consumed, and every node must appear in
 * it only once.
 *
 * <p>Identities are looked up on the sequence nodes and on the self-nesting nodes nested inside
 * them. An unresolvable parent identity makes the node an orphan; orphans are dropped (and logged)
 * or rejected depending on {@link HierarchyOptions#orphanPolicy()}. So is a node whose parent
 * references lead back to itself. Under {@link OrphanPolicy#FAIL} every reference is checked
 * before any node is moved.
 */
@Component
public class HierarchyRebuilder {

  private static final Logger log = LoggerFactory.getLogger(HierarchyRebuilder.class);

  /**
   * Rebuilds the tree.
   *
   * @return the synthetic root holding every top-level self-nesting node
   * @throws StructuralException if no top-level node exists, or an orphan or duplicate identity is
   *     found under a fail-fast policy
   */
  public XmlNode rebuild(List<XmlNode> nodes, HierarchyOptions options) {
    Map<String, XmlNode> byId = indexIdentities(nodes, options);

    if (options.orphanPolicy() == OrphanPolicy.FAIL) {
      List<String> unresolved =
          nodes.stream()
              .map(node -> node.attribute(options.parentAttr()))
              .filter(parentId -> parentId != null && !parentId.isEmpty())
              .filter(parentId -> !byId.containsKey(parentId))
              .distinct()
              .toList();
      if (!unresolved.isEmpty()) {
        throw new StructuralException(
            "Unresolvable " + options.parentAttr() + " values: " + String.join(", ", unresolved));
      }
      List<XmlNode> cyclic = findCycles(nodes, byId, options);
      if (!cyclic.isEmpty()) {
        handleOrphans(cyclic, options);
      }
    }

    XmlNode root = null;
    List<XmlNode> orphans = new ArrayList<>();
    for (XmlNode node : nodes) {
      String parentId = node.attribute(options.parentAttr());
      if (parentId != null && !parentId.isEmpty()) {
        XmlNode parent = byId.get(parentId);
        if (parent == null || parent == node || node.isAncestorOf(parent)) {
          orphans.add(node);
        } else {
          parent.append(node);
        }
      } else if (node.hasTag(options.matchTag())) {
        if (root == null) {
          root = new XmlNode(options.rootTag());
        }
        root.append(node);
      }
    }

    if (root == null) {
      throw new StructuralException("no top-level element found");
    }
    if (!orphans.isEmpty()) {
      handleOrphans(orphans, options);
    }
    if (options.stripMarkers()) {
      stripMarkers(root, options);
    }
    return root;
  }

  private Map<String, XmlNode> indexIdentities(List<XmlNode> nodes, HierarchyOptions options) {
    Map<String, XmlNode> byId = new HashMap<>();
    for (XmlNode node : nodes) {
      register(node, byId, options);
      for (XmlNode nested : node.descendants(options.matchTag())) {
        register(nested, byId, options);
      }
    }
    return byId;
  }

  /**
   * Returns the sequence nodes whose chain of parent references leads back to themselves. Nested
   * identities count as the sequence node that contains them.
   */
  private static List<XmlNode> findCycles(
      List<XmlNode> nodes, Map<String, XmlNode> byId, HierarchyOptions options) {
    Map<XmlNode, XmlNode> owners = new IdentityHashMap<>();
    for (XmlNode node : nodes) {
      owners.put(node, node);
    }
    for (XmlNode node : nodes) {
      for (XmlNode nested : node.descendants(options.matchTag())) {
        owners.putIfAbsent(nested, node);
      }
    }

    List<XmlNode> cyclic = new ArrayList<>();
    for (XmlNode start : nodes) {
      Set<XmlNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
      XmlNode current = start;
      while (current != null && seen.add(current)) {
        current = owningParent(current, byId, owners, options);
      }
      if (current == start) {
        cyclic.add(start);
      }
    }
    return cyclic;
  }

  private static @Nullable XmlNode owningParent(
      XmlNode node,
      Map<String, XmlNode> byId,
      Map<XmlNode, XmlNode> owners,
      HierarchyOptions options) {
    String parentId = node.attribute(options.parentAttr());
    if (parentId == null || parentId.isEmpty()) {
      return null;
    }
    XmlNode parent = byId.get(parentId);
    return parent == null ? null : owners.get(parent);
  }

  private void register(XmlNode node, Map<String, XmlNode> byId, HierarchyOptions options) {
    if (!node.hasAttribute(options.idAttr())) {
      return;
    }
    String id = node.attribute(options.idAttr());
    XmlNode previous = byId.put(id, node);
    if (previous != null && previous != node) {
      if (options.duplicateIdPolicy() == DuplicateIdPolicy.FAIL) {
        throw new StructuralException("Duplicate " + options.idAttr() + ": " + id);
      }
      log.warn("Duplicate {} {}; the later node takes it", options.idAttr(), id);
    }
  }

  private void handleOrphans(List<XmlNode> orphans, HierarchyOptions options) {
    String ids =
        orphans.stream()
            .map(node -> describe(node, options))
            .collect(Collectors.joining(", "));
    if (options.orphanPolicy() == OrphanPolicy.FAIL) {
      throw new StructuralException("Orphaned nodes: " + ids);
    }
    log.warn("Dropped {} orphaned nodes: {}", orphans.size(), ids);
  }

  private static String describe(XmlNode node, HierarchyOptions options) {
    return "<%s %s=%s %s=%s>"
        .formatted(
            node.getTag(),
            options.idAttr(),
            node.attribute(options.idAttr()),
            options.parentAttr(),
            node.attribute(options.parentAttr()));
  }

  private static void stripMarkers(XmlNode node, HierarchyOptions options) {
    if (node.hasTag(options.matchTag())) {
      node.removeAttribute(options.idAttr());
      node.removeAttribute(options.parentAttr());
    }
    for (XmlNode child : node.getChildren()) {
      stripMarkers(child, options);
    }
  }
}

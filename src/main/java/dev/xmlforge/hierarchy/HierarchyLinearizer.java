package dev.xmlforge.hierarchy;

import dev.xmlforge.tree.XmlNode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a recursively self-nested tree into a flat sequence linked by identity attributes.
 *
 * <p>A child is detached from its parent only when both carry the match tag. Detached children
 * are visited after the parent's other children, and each detached copy is appended to the output
 * once its own subtree has been processed, so deeper detached subtrees precede the subtree that
 * contained them. The pruned root copy always comes first, whatever its tag.
 *
 * <p>Sibling order is kept among the children that stay and among the detached ones, but not
 * between the two groups: a rebuild appends self-nesting children after the other children, so
 * {@code Name, Product, Price} comes back as {@code Name, Price, Product}.
 *
 * <p>The input tree is left untouched unless {@link HierarchyOptions#writeBackIds()} is set;
 * synthesized identities are reported in {@link FlattenResult#assignedIds()}.
 */
@Component
public class HierarchyLinearizer {

  private static final Logger log = LoggerFactory.getLogger(HierarchyLinearizer.class);

  // bound on re-draws when a synthesized id collides with one already in use
  private static final int MAX_ID_ATTEMPTS = 16;

  private final IdGenerator idGenerator;

  public HierarchyLinearizer(IdGenerator idGenerator) {
    this.idGenerator = idGenerator;
  }

  /**
   * Flattens a tree.
   *
   * @param root the tree to flatten; not modified unless ids are written back
   * @param options match tag and marker attribute names
   * @return the flattened sequence and the identities synthesized on the way
   */
  public FlattenResult flatten(XmlNode root, HierarchyOptions options) {
    Run run = new Run(options);
    run.collectExistingIds(root);
    XmlNode rootCopy = run.visit(root, null);

    List<XmlNode> nodes = new ArrayList<>(run.detached.size() + 1);
    nodes.add(rootCopy);
    nodes.addAll(run.detached);
    log.debug(
        "Flattened <{}> into {} nodes ({} ids synthesized)",
        options.matchTag(),
        nodes.size(),
        run.assignedIds.size());
    return new FlattenResult(nodes, run.assignedIds);
  }

  private final class Run {

    private final HierarchyOptions options;
    private final List<XmlNode> detached = new ArrayList<>();
    private final Map<XmlNode, String> assignedIds = new IdentityHashMap<>();
    private final Set<String> usedIds = new HashSet<>();

    private Run(HierarchyOptions options) {
      this.options = options;
    }

    private void collectExistingIds(XmlNode node) {
      if (node.hasTag(options.matchTag()) && node.hasAttribute(options.idAttr())) {
        usedIds.add(node.attribute(options.idAttr()));
      }
      for (XmlNode child : node.getChildren()) {
        collectExistingIds(child);
      }
    }

    /**
     * Returns a copy of {@code node} without its detached children; those are flattened into
     * {@link #detached} as a side effect.
     *
     * @param parentId identity of the nearest enclosing self-nesting node, if any
     */
    private XmlNode visit(XmlNode node, @Nullable String parentId) {
      boolean selfNesting = node.hasTag(options.matchTag());
      String id = selfNesting ? identityOf(node) : null;

      XmlNode copy = node.shallowCopy();
      if (id != null) {
        copy.setAttribute(options.idAttr(), id);
        if (parentId != null) {
          copy.setAttribute(options.parentAttr(), parentId);
        } else {
          // a stale marker would make the outermost node look like a child
          copy.removeAttribute(options.parentAttr());
        }
      }

      String scopeId = id != null ? id : parentId;
      List<XmlNode> toDetach = new ArrayList<>();
      for (XmlNode child : node.getChildren()) {
        if (selfNesting && child.hasTag(options.matchTag())) {
          toDetach.add(child);
        } else {
          copy.append(visit(child, scopeId));
        }
      }
      for (XmlNode child : toDetach) {
        detached.add(visit(child, id));
      }
      return copy;
    }

    private String identityOf(XmlNode node) {
      if (node.hasAttribute(options.idAttr())) {
        return node.attribute(options.idAttr());
      }
      String id = drawUnusedId();
      assignedIds.put(node, id);
      if (options.writeBackIds()) {
        node.setAttribute(options.idAttr(), id);
      }
      return id;
    }

    private String drawUnusedId() {
      String id = idGenerator.nextId();
      for (int attempt = 1; attempt < MAX_ID_ATTEMPTS && usedIds.contains(id); attempt++) {
        log.debug("Synthesized id {} already in use, drawing again", id);
        id = idGenerator.nextId();
      }
      if (usedIds.contains(id)) {
        log.warn("Synthesized id {} collides with an existing id", id);
      }
      usedIds.add(id);
      return id;
    }
  }
}

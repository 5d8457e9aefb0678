package dev.xmlforge.hierarchy;

import dev.xmlforge.tree.XmlNode;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link HierarchyLinearizer#flatten}.
 *
 * @param nodes the pruned root copy first, then every detached subtree copy in the order its
 *     detachment completed
 * @param assignedIds identities synthesized during the call, keyed by the original input node
 *     (identity-keyed); empty when every self-nesting node already had one
 */
public record FlattenResult(List<XmlNode> nodes, Map<XmlNode, String> assignedIds) {

  public FlattenResult {
    nodes = List.copyOf(nodes);
    assignedIds = Collections.unmodifiableMap(new IdentityHashMap<>(assignedIds));
  }

  public XmlNode root() {
    return nodes.get(0);
  }

  /** The detached subtrees, without the root. */
  public List<XmlNode> detached() {
    return nodes.subList(1, nodes.size());
  }

  public int size() {
    return nodes.size();
  }
}

package dev.xmlforge.hierarchy;

import java.util.Objects;
import java.util.Set;

/**
 * Settings shared by flattening and rebuilding.
 *
 * @param matchTag the self-nesting tag
 * @param idAttr attribute carrying a node's identity
 * @param parentAttr attribute carrying the identity of the enclosing self-nesting node
 * @param rootTag tag of the synthetic root created by rebuilding
 * @param orphanPolicy what rebuilding does with unresolvable parent references
 * @param duplicateIdPolicy what rebuilding does with identities carried by several nodes
 * @param writeBackIds whether flattening also sets synthesized ids on the input tree
 * @param stripMarkers whether rebuilding removes the id and parent attributes it linked on
 */
public record HierarchyOptions(
    String matchTag,
    String idAttr,
    String parentAttr,
    String rootTag,
    OrphanPolicy orphanPolicy,
    DuplicateIdPolicy duplicateIdPolicy,
    boolean writeBackIds,
    boolean stripMarkers) {

  public static final String DEFAULT_ID_ATTR = "id";
  public static final String DEFAULT_PARENT_ATTR = "parent_id";
  public static final String DEFAULT_ROOT_TAG = "root";

  public HierarchyOptions {
    requireNonBlank(matchTag, "matchTag");
    requireNonBlank(idAttr, "idAttr");
    requireNonBlank(parentAttr, "parentAttr");
    requireNonBlank(rootTag, "rootTag");
    if (idAttr.equals(parentAttr)) {
      throw new IllegalArgumentException("idAttr and parentAttr must differ");
    }
    Objects.requireNonNull(orphanPolicy, "orphanPolicy must not be null");
    Objects.requireNonNull(duplicateIdPolicy, "duplicateIdPolicy must not be null");
  }

  public static HierarchyOptions of(String matchTag) {
    return of(matchTag, DEFAULT_ID_ATTR, DEFAULT_PARENT_ATTR);
  }

  public static HierarchyOptions of(String matchTag, String idAttr, String parentAttr) {
    return new HierarchyOptions(
        matchTag,
        idAttr,
        parentAttr,
        DEFAULT_ROOT_TAG,
        OrphanPolicy.DROP,
        DuplicateIdPolicy.LAST_WINS,
        false,
        false);
  }

  public HierarchyOptions withOrphanPolicy(OrphanPolicy policy) {
    return new HierarchyOptions(
        matchTag, idAttr, parentAttr, rootTag, policy, duplicateIdPolicy, writeBackIds,
        stripMarkers);
  }

  public HierarchyOptions withDuplicateIdPolicy(DuplicateIdPolicy policy) {
    return new HierarchyOptions(
        matchTag, idAttr, parentAttr, rootTag, orphanPolicy, policy, writeBackIds, stripMarkers);
  }

  public HierarchyOptions withWriteBackIds(boolean enabled) {
    return new HierarchyOptions(
        matchTag, idAttr, parentAttr, rootTag, orphanPolicy, duplicateIdPolicy, enabled,
        stripMarkers);
  }

  public HierarchyOptions withStripMarkers(boolean enabled) {
    return new HierarchyOptions(
        matchTag, idAttr, parentAttr, rootTag, orphanPolicy, duplicateIdPolicy, writeBackIds,
        enabled);
  }

  public HierarchyOptions withRootTag(String tag) {
    return new HierarchyOptions(
        matchTag, idAttr, parentAttr, tag, orphanPolicy, duplicateIdPolicy, writeBackIds,
        stripMarkers);
  }

  /** The two marker attributes, for comparisons that ignore them. */
  public Set<String> markerAttributes() {
    return Set.of(idAttr, parentAttr);
  }

  private static void requireNonBlank(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must not be blank");
    }
  }
}

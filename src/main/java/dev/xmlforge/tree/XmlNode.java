package dev.xmlforge.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * Ordered-tree unit shared by the split and hierarchy pipelines: a tag name, an insertion-ordered
 * attribute map, optional text and an ordered list of children.
 *
 * <p>A node is owned by at most one child list. {@link #append(XmlNode)} moves a node that
 * already has a parent, and {@link #detach()} clears the back-reference, so no node is ever
 * reachable from two parents.
 */
public final class XmlNode {

  private final String tag;
  private final Map<String, String> attributes = new LinkedHashMap<>();
  private final List<XmlNode> children = new ArrayList<>();
  private @Nullable String text;
  private @Nullable XmlNode parent;

  public XmlNode(String tag) {
    if (tag == null || tag.isBlank()) {
      throw new IllegalArgumentException("tag must not be blank");
    }
    this.tag = tag;
  }

  public XmlNode(String tag, Map<String, String> attributes, @Nullable String text) {
    this(tag);
    this.attributes.putAll(attributes);
    this.text = text;
  }

  public String getTag() {
    return tag;
  }

  public boolean hasTag(String name) {
    return tag.equals(name);
  }

  /** Returns an unmodifiable view of the attributes, in insertion order. */
  public Map<String, String> getAttributes() {
    return Collections.unmodifiableMap(attributes);
  }

  public @Nullable String attribute(String name) {
    return attributes.get(name);
  }

  /** Returns true if the attribute is present and not empty. */
  public boolean hasAttribute(String name) {
    String value = attributes.get(name);
    return value != null && !value.isEmpty();
  }

  public XmlNode setAttribute(String name, String value) {
    attributes.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
    return this;
  }

  public @Nullable String removeAttribute(String name) {
    return attributes.remove(name);
  }

  public @Nullable String getText() {
    return text;
  }

  public XmlNode setText(@Nullable String text) {
    this.text = text;
    return this;
  }

  public @Nullable XmlNode getParent() {
    return parent;
  }

  /** Returns an unmodifiable view of the children in document order. */
  public List<XmlNode> getChildren() {
    return Collections.unmodifiableList(children);
  }

  public int childCount() {
    return children.size();
  }

  public XmlNode child(int index) {
    return children.get(index);
  }

  /**
   * Appends a child. A child that belongs to another parent is detached from it first.
   *
   * @return this node, for chaining
   */
  public XmlNode append(XmlNode child) {
    if (child == this || child.isAncestorOf(this)) {
      throw new IllegalArgumentException("appending <" + child.tag + "> would create a cycle");
    }
    if (child.parent != null) {
      child.detach();
    }
    children.add(child);
    child.parent = this;
    return this;
  }

  /** Returns true if this node is a proper ancestor of {@code other}. */
  public boolean isAncestorOf(XmlNode other) {
    for (XmlNode node = other.parent; node != null; node = node.parent) {
      if (node == this) {
        return true;
      }
    }
    return false;
  }

  /** Removes this node from its parent's child list. Does nothing for a root. */
  public XmlNode detach() {
    if (parent != null) {
      parent.removeChild(this);
      parent = null;
    }
    return this;
  }

  /** Removes every child, clearing their back-references. */
  public void clearChildren() {
    for (XmlNode child : children) {
      child.parent = null;
    }
    children.clear();
  }

  private void removeChild(XmlNode child) {
    for (int i = 0; i < children.size(); i++) {
      if (children.get(i) == child) {
        children.remove(i);
        return;
      }
    }
  }

  /** First direct child with the given tag. */
  public @Nullable XmlNode first(String name) {
    for (XmlNode child : children) {
      if (child.hasTag(name)) {
        return child;
      }
    }
    return null;
  }

  /** Direct children with the given tag, in document order. */
  public List<XmlNode> children(String name) {
    List<XmlNode> result = new ArrayList<>();
    for (XmlNode child : children) {
      if (child.hasTag(name)) {
        result.add(child);
      }
    }
    return result;
  }

  /** Descendants (not including this node) with the given tag, in document order. */
  public List<XmlNode> descendants(String name) {
    List<XmlNode> result = new ArrayList<>();
    collectDescendants(name, result);
    return result;
  }

  private void collectDescendants(String name, List<XmlNode> result) {
    for (XmlNode child : children) {
      if (child.hasTag(name)) {
        result.add(child);
      }
      child.collectDescendants(name, result);
    }
  }

  /** Copy of tag, attributes and text, without children and without a parent. */
  public XmlNode shallowCopy() {
    return new XmlNode(tag, attributes, text);
  }

  public XmlNode deepCopy() {
    XmlNode copy = shallowCopy();
    for (XmlNode child : children) {
      copy.append(child.deepCopy());
    }
    return copy;
  }

  /**
   * Compares tags, attributes, text and, recursively, children in order. Attributes named in
   * {@code ignoredAttributes} are left out of the comparison on both sides.
   */
  public boolean structurallyEquals(XmlNode other, Set<String> ignoredAttributes) {
    if (!tag.equals(other.tag) || !Objects.equals(text, other.text)) {
      return false;
    }
    if (!filtered(attributes, ignoredAttributes)
        .equals(filtered(other.attributes, ignoredAttributes))) {
      return false;
    }
    if (children.size() != other.children.size()) {
      return false;
    }
    for (int i = 0; i < children.size(); i++) {
      if (!children.get(i).structurallyEquals(other.children.get(i), ignoredAttributes)) {
        return false;
      }
    }
    return true;
  }

  private static Map<String, String> filtered(Map<String, String> source, Set<String> ignored) {
    if (ignored.isEmpty()) {
      return source;
    }
    Map<String, String> result = new LinkedHashMap<>(source);
    result.keySet().removeAll(ignored);
    return result;
  }

  @Override
  public String toString() {
    return "<" + tag + " " + attributes + " children=" + children.size() + ">";
  }
}

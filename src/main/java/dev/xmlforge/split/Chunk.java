package dev.xmlforge.split;

import dev.xmlforge.tree.XmlNode;
import java.util.List;

/**
 * One bounded group of matched elements, wrapped in a synthetic container element.
 *
 * <p>{@code index} is the zero-based position of the chunk in the whole run, across every
 * source. The container is built once by the partitioner and not modified afterwards.
 *
 * @param index run-wide chunk number
 * @param container synthetic element whose children are the matched elements in document order
 */
public record Chunk(int index, XmlNode container) {

  public Chunk {
    if (index < 0) {
      throw new IllegalArgumentException("index must not be negative");
    }
    if (container.childCount() == 0) {
      throw new IllegalArgumentException("a chunk holds at least one element");
    }
  }

  static Chunk of(int index, String containerTag, List<XmlNode> elements) {
    XmlNode container = new XmlNode(containerTag);
    for (XmlNode element : elements) {
      container.append(element);
    }
    return new Chunk(index, container);
  }

  /** The matched elements, in the order they were encountered. */
  public List<XmlNode> elements() {
    return container.getChildren();
  }

  public int size() {
    return container.childCount();
  }
}

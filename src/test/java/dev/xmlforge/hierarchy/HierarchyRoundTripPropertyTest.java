package dev.xmlforge.hierarchy;

import static org.assertj.core.api.Assertions.assertThat;

import dev.xmlforge.tree.XmlNode;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

/**
 * Property-based tests for flatten followed by rebuild on randomly shaped self-nesting trees.
 *
 * <p>Trees are grown from a seed: every {@code Product} holds some leaf elements, sometimes a
 * {@code Group} wrapping a product (which is never detached), then zero to three nested products.
 * About half of the products carry an id; the rest get one synthesized. Nested products always
 * follow the other children, since a rebuild appends them last.
 */
class HierarchyRoundTripPropertyTest {

  private static final HierarchyOptions OPTIONS = HierarchyOptions.of("Product");

  @Property(tries = 200)
  void rebuildRestoresTheFlattenedTree(@ForAll long seed) {
    XmlNode original = grow(new Random(seed), new AtomicInteger(), 0);
    XmlNode snapshot = original.deepCopy();
    AtomicInteger generated = new AtomicInteger();
    HierarchyLinearizer linearizer =
        new HierarchyLinearizer(() -> "gen" + generated.incrementAndGet());

    FlattenResult flattened = linearizer.flatten(original, OPTIONS);
    XmlNode rebuilt = new HierarchyRebuilder().rebuild(flattened.nodes(), OPTIONS);

    assertThat(rebuilt.childCount()).isEqualTo(1);
    assertThat(rebuilt.child(0).structurallyEquals(original, OPTIONS.markerAttributes()))
        .isTrue();
    assertThat(original.structurallyEquals(snapshot, Set.of())).isTrue();
  }

  @Property(tries = 200)
  void everyFlattenedNodeIsFreeOfDetachableDescendants(@ForAll long seed) {
    XmlNode original = grow(new Random(seed), new AtomicInteger(), 0);
    AtomicInteger generated = new AtomicInteger();

    FlattenResult flattened =
        new HierarchyLinearizer(() -> "gen" + generated.incrementAndGet())
            .flatten(original, OPTIONS);

    for (XmlNode node : flattened.nodes()) {
      assertThat(node.hasAttribute("id")).isTrue();
      assertThat(node.children("Product")).isEmpty();
    }
    assertThat(flattened.nodes()).hasSize(1 + countNestedProducts(original));
  }

  private static XmlNode grow(Random random, AtomicInteger counter, int depth) {
    XmlNode product = new XmlNode("Product");
    int number = counter.incrementAndGet();
    if (random.nextBoolean()) {
      product.setAttribute("id", "p" + number);
    }
    if (random.nextInt(3) == 0) {
      product.setAttribute("sku", "S-" + number);
    }
    int leaves = random.nextInt(3);
    for (int i = 0; i < leaves; i++) {
      product.append(new XmlNode("Field" + i).setText("value " + number + "." + i));
    }
    if (depth < 3 && random.nextInt(4) == 0) {
      product.append(new XmlNode("Group").append(grow(random, counter, depth + 1)));
    }
    int nested = depth < 4 ? random.nextInt(4) : 0;
    for (int i = 0; i < nested; i++) {
      product.append(grow(random, counter, depth + 1));
    }
    return product;
  }

  // products nested directly in a product, at any depth, excluding ones under a Group
  private static int countNestedProducts(XmlNode node) {
    int count = 0;
    for (XmlNode child : node.getChildren()) {
      if (child.hasTag("Product")) {
        count += 1 + countNestedProducts(child);
      } else {
        count += countDirectProductsInside(child);
      }
    }
    return count;
  }

  private static int countDirectProductsInside(XmlNode wrapper) {
    int count = 0;
    for (XmlNode child : wrapper.getChildren()) {
      if (child.hasTag("Product")) {
        count += countNestedProducts(child);
      } else {
        count += countDirectProductsInside(child);
      }
    }
    return count;
  }
}

package dev.xmlforge.hierarchy;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults of the hierarchy pipeline, bound from {@code xmlforge.hierarchy.*}.
 *
 * <ul>
 *   <li>{@code id-attr} / {@code parent-attr} - identity marker attributes (default {@code id} /
 *       {@code parent_id})
 *   <li>{@code id-length} - length of synthesized ids (default 8, at least 4)
 *   <li>{@code orphan-policy} - DROP (default) or FAIL
 *   <li>{@code duplicate-id-policy} - LAST_WINS (default) or FAIL
 *   <li>{@code root-tag} - synthetic root created by rebuilding (default {@code root})
 *   <li>{@code container-tag} - element wrapping a flattened sequence on disk (default {@code
 *       flattened})
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "xmlforge.hierarchy")
public record HierarchyProperties(
    @DefaultValue("id") @NotBlank String idAttr,
    @DefaultValue("parent_id") @NotBlank String parentAttr,
    @DefaultValue("8") @Min(4) int idLength,
    @DefaultValue("DROP") @NotNull OrphanPolicy orphanPolicy,
    @DefaultValue("LAST_WINS") @NotNull DuplicateIdPolicy duplicateIdPolicy,
    @DefaultValue("root") @NotBlank String rootTag,
    @DefaultValue("flattened") @NotBlank String containerTag) {

  public HierarchyOptions toOptions(String matchTag) {
    return new HierarchyOptions(
        matchTag,
        idAttr,
        parentAttr,
        rootTag,
        orphanPolicy,
        duplicateIdPolicy,
        false,
        false);
  }
}

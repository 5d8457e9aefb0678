package dev.xmlforge.mcp;

import dev.xmlforge.exception.XmlSyntaxException;
import dev.xmlforge.hierarchy.FlattenResult;
import dev.xmlforge.hierarchy.HierarchyOptions;
import dev.xmlforge.hierarchy.HierarchyService;
import dev.xmlforge.hierarchy.OrphanPolicy;
import dev.xmlforge.split.SourceErrorPolicy;
import dev.xmlforge.split.SplitOptions;
import dev.xmlforge.split.SplitResult;
import dev.xmlforge.split.SplitService;
import dev.xmlforge.tree.WellFormednessChecker;
import dev.xmlforge.tree.XmlNode;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the split and hierarchy pipelines as tool methods.
 *
 * <p>Tool methods never throw: every exception is caught and returned as a descriptive error
 * string, so the calling agent can correct its arguments and retry.
 *
 * <p>Tools: {@code split_xml}, {@code flatten_hierarchy}, {@code rebuild_hierarchy}, {@code
 * check_well_formed}.
 *
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  private final SplitService splitService;
  private final HierarchyService hierarchyService;
  private final WellFormednessChecker wellFormednessChecker;

  public McpToolService(
      SplitService splitService,
      HierarchyService hierarchyService,
      WellFormednessChecker wellFormednessChecker) {
    this.splitService = splitService;
    this.hierarchyService = hierarchyService;
    this.wellFormednessChecker = wellFormednessChecker;
  }

  /** Splits a document, a directory of documents or a ZIP archive into chunk files. */
  @Tool(
      name = "split_xml",
      description =
          "Split large XML input into chunk files of at most chunkSize elements with the given "
              + "tag. "
              + "Input may be a single XML file, a directory of XML files, or a .zip archive. "
              + "Chunks are written as chunk_0000.xml, chunk_0001.xml, ... into outputDir.")
  public String splitXml(
      @ToolParam(description = "Path to an XML file, a directory or a .zip archive")
          @Nullable String input,
      @ToolParam(description = "Directory receiving the chunk files (created if absent)")
          @Nullable String outputDir,
      @ToolParam(description = "Tag name of the elements to group, e.g. 'record'")
          @Nullable String matchTag,
      @ToolParam(description = "Maximum elements per chunk (default 1000)", required = false)
          @Nullable Integer chunkSize,
      @ToolParam(
              description = "Glob on file names when input is a directory (default '*.xml')",
              required = false)
          @Nullable String pattern,
      @ToolParam(description = "Descend into subdirectories (default false)", required = false)
          @Nullable Boolean recursive,
      @ToolParam(
              description = "Skip malformed source documents instead of aborting",
              required = false)
          @Nullable Boolean skipMalformed) {
    try {
      if (isBlank(input) || isBlank(outputDir) || isBlank(matchTag)) {
        return "Error: input, outputDir and matchTag are required.";
      }
      SplitOptions defaults = splitService.defaultOptions(matchTag);
      SplitOptions options =
          new SplitOptions(
              matchTag,
              chunkSize != null ? chunkSize : defaults.chunkSize(),
              !isBlank(pattern) ? pattern : defaults.pattern(),
              recursive != null ? recursive : defaults.recursive(),
              defaults.containerTag(),
              skipMalformed == null
                  ? defaults.onSourceError()
                  : skipMalformed ? SourceErrorPolicy.SKIP : SourceErrorPolicy.FAIL);

      SplitResult result = splitService.split(Path.of(input), Path.of(outputDir), options);
      StringBuilder sb = new StringBuilder();
      sb.append(
          "Wrote %d chunks (%,d <%s> elements from %d sources) to %s"
              .formatted(
                  result.chunks(),
                  result.elements(),
                  matchTag,
                  result.sourcesProcessed(),
                  result.outputDir()));
      if (!result.skippedSources().isEmpty()) {
        sb.append("\nSkipped malformed sources: ")
            .append(String.join(", ", result.skippedSources()));
      }
      return sb.toString();
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.debug("split_xml failed", e);
      return "Error splitting XML: " + e.getMessage();
    }
  }

  /** Flattens the matchTag hierarchy of a document into an id-linked sequence. */
  @Tool(
      name = "flatten_hierarchy",
      description =
          "Flatten nested elements with the given tag into a flat sequence linked by id and "
              + "parent_id attributes. Missing ids are generated. The sequence is written to "
              + "output wrapped in a <flattened> element.")
  public String flattenHierarchy(
      @ToolParam(description = "Path of the XML document to flatten") @Nullable String input,
      @ToolParam(description = "Path of the file receiving the flattened sequence")
          @Nullable String output,
      @ToolParam(description = "Tag name of the hierarchical elements, e.g. 'Product'")
          @Nullable String matchTag,
      @ToolParam(description = "Identity attribute name (default 'id')", required = false)
          @Nullable String idAttr,
      @ToolParam(description = "Parent reference attribute (default 'parent_id')", required = false)
          @Nullable String parentAttr) {
    try {
      if (isBlank(input) || isBlank(output) || isBlank(matchTag)) {
        return "Error: input, output and matchTag are required.";
      }
      HierarchyOptions options = hierarchyOptions(matchTag, idAttr, parentAttr);
      FlattenResult result =
          hierarchyService.flattenFile(Path.of(input), Path.of(output), options);
      return "Flattened %s into %d nodes (%d ids generated), written to %s"
          .formatted(input, result.size(), result.assignedIds().size(), output);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.debug("flatten_hierarchy failed", e);
      return "Error flattening hierarchy: " + e.getMessage();
    }
  }

  /** Rebuilds a tree from a flattened sequence. */
  @Tool(
      name = "rebuild_hierarchy",
      description =
          "Rebuild the nested tree from a flattened sequence (the children of the input's root "
              + "element) by following parent_id references. Top-level elements are placed "
              + "under a <root> element.")
  public String rebuildHierarchy(
      @ToolParam(description = "Path of the document holding the flattened sequence")
          @Nullable String input,
      @ToolParam(description = "Path of the file receiving the rebuilt tree")
          @Nullable String output,
      @ToolParam(description = "Tag name of the hierarchical elements, e.g. 'Product'")
          @Nullable String matchTag,
      @ToolParam(description = "Identity attribute name (default 'id')", required = false)
          @Nullable String idAttr,
      @ToolParam(description = "Parent reference attribute (default 'parent_id')", required = false)
          @Nullable String parentAttr,
      @ToolParam(
              description =
                  "What to do with nodes whose parent is missing: DROP (default) or FAIL",
              required = false)
          @Nullable String orphanPolicy,
      @ToolParam(
              description = "Remove id and parent attributes from the rebuilt tree",
              required = false)
          @Nullable Boolean stripMarkers) {
    try {
      if (isBlank(input) || isBlank(output) || isBlank(matchTag)) {
        return "Error: input, output and matchTag are required.";
      }
      HierarchyOptions options = hierarchyOptions(matchTag, idAttr, parentAttr);
      if (!isBlank(orphanPolicy)) {
        options = options.withOrphanPolicy(parseOrphanPolicy(orphanPolicy));
      }
      if (stripMarkers != null) {
        options = options.withStripMarkers(stripMarkers);
      }
      XmlNode root = hierarchyService.rebuildFile(Path.of(input), Path.of(output), options);
      return "Rebuilt %d top-level <%s> elements under <%s>, written to %s"
          .formatted(root.childCount(), matchTag, root.getTag(), output);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.debug("rebuild_hierarchy failed", e);
      return "Error rebuilding hierarchy: " + e.getMessage();
    }
  }

  /** Reports whether a file parses as well-formed XML. */
  @Tool(
      name = "check_well_formed",
      description = "Check whether a file is well-formed XML. Reports the first syntax error.")
  public String checkWellFormed(
      @ToolParam(description = "Path of the XML file to check") @Nullable String input) {
    try {
      if (isBlank(input)) {
        return "Error: input must not be empty. Provide a file path.";
      }
      Path path = Path.of(input);
      if (!Files.isRegularFile(path)) {
        return "Error: File not found: " + input;
      }
      if (wellFormednessChecker.isWellFormed(path)) {
        return input + " is well-formed XML.";
      }
      return input + " is NOT well-formed XML: " + describeFailure(path);
    } catch (Exception e) {
      return "Error checking well-formedness: " + e.getMessage();
    }
  }

  private String describeFailure(Path path) {
    try {
      wellFormednessChecker.check(path);
      return "unknown error";
    } catch (XmlSyntaxException e) {
      return e.getMessage();
    }
  }

  private HierarchyOptions hierarchyOptions(
      String matchTag, @Nullable String idAttr, @Nullable String parentAttr) {
    HierarchyOptions defaults = hierarchyService.defaultOptions(matchTag);
    return new HierarchyOptions(
        matchTag,
        !isBlank(idAttr) ? idAttr : defaults.idAttr(),
        !isBlank(parentAttr) ? parentAttr : defaults.parentAttr(),
        defaults.rootTag(),
        defaults.orphanPolicy(),
        defaults.duplicateIdPolicy(),
        defaults.writeBackIds(),
        defaults.stripMarkers());
  }

  private static OrphanPolicy parseOrphanPolicy(String value) {
    try {
      return OrphanPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException(
          "Invalid orphanPolicy '" + value + "'. Use DROP or FAIL.", e);
    }
  }

  private static boolean isBlank(@Nullable String value) {
    return value == null || value.isBlank();
  }
}

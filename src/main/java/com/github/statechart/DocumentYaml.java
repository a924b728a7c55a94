package com.github.statechart;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Representer;

import com.github.statechart.StatechartException.Code;

/**
 * SnakeYAML plumbing for the document format plus lenient typed readers over the parsed tree.
 * Yaml instances are not thread-safe, so one is made per call.
 */
final class DocumentYaml {

  static String dump(final Map<String, Object> document) {
    final DumperOptions dumperOptions = new DumperOptions();
    dumperOptions.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
    dumperOptions.setIndent(2);
    dumperOptions.setWidth(Integer.MAX_VALUE);
    dumperOptions.setSplitLines(false);
    final LoaderOptions loaderOptions = new LoaderOptions();
    final Yaml yaml = new Yaml(new SafeConstructor(loaderOptions),
        new LiteralBlockRepresenter(dumperOptions), dumperOptions, loaderOptions);
    return yaml.dump(document);
  }

  /**
   * Parses document text into its root mapping. Empty text is an empty document.
   */
  static Map<?, ?> load(final String text) throws StatechartException {
    if (text == null || text.trim().isEmpty()) {
      return Collections.emptyMap();
    }
    final Object root;
    try {
      final LoaderOptions loaderOptions = new LoaderOptions();
      root = new Yaml(new SafeConstructor(loaderOptions)).load(text);
    } catch (YAMLException parseFailure) {
      throw new StatechartException(Code.MALFORMED_DOCUMENT, parseFailure.getMessage(),
          parseFailure);
    }
    if (root == null) {
      return Collections.emptyMap();
    }
    if (!(root instanceof Map)) {
      throw new StatechartException(Code.MALFORMED_DOCUMENT,
          "Document root must be a mapping but was " + root.getClass().getSimpleName());
    }
    return (Map<?, ?>) root;
  }

  static String text(final Map<?, ?> record, final String key) {
    final Object value = record.get(key);
    return value == null ? "" : String.valueOf(value);
  }

  static boolean flag(final Map<?, ?> record, final String key) {
    final Object value = record.get(key);
    return Boolean.TRUE.equals(value) || "true".equals(value);
  }

  static Double number(final Map<?, ?> record, final String key) {
    final Object value = record.get(key);
    if (value instanceof Number) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof String) {
      try {
        return Double.valueOf((String) value);
      } catch (NumberFormatException notANumber) {
        return null;
      }
    }
    return null;
  }

  static double number(final Map<?, ?> record, final String key, final double fallback) {
    final Double value = number(record, key);
    return value == null ? fallback : value;
  }

  static Map<?, ?> mapping(final Map<?, ?> record, final String key) {
    final Object value = record.get(key);
    return value instanceof Map ? (Map<?, ?>) value : null;
  }

  static List<?> sequence(final Object value) {
    return value instanceof List ? (List<?>) value : Collections.emptyList();
  }

  static Point point(final Map<?, ?> record, final String key) {
    final Map<?, ?> position = mapping(record, key);
    if (position == null) {
      return null;
    }
    return Point.of(number(position, "x", 0), number(position, "y", 0));
  }

  static Marker marker(final Map<?, ?> record, final String positionKey, final String sizeKey) {
    final Point position = point(record, positionKey);
    if (position == null) {
      return null;
    }
    return Marker.of(position, number(record, sizeKey, 0));
  }

  /**
   * Whole numbers are written without a fractional part.
   */
  static Object numeric(final double value) {
    if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
      return Long.valueOf((long) value);
    }
    return Double.valueOf(value);
  }

  static Map<String, Object> point(final Point point) {
    final Map<String, Object> position = new LinkedHashMap<>();
    position.put("x", numeric(point.getX()));
    position.put("y", numeric(point.getY()));
    return position;
  }

  static List<Object> points(final List<Point> points) {
    final List<Object> list = new ArrayList<>(points.size());
    for (final Point point : points) {
      list.add(point(point));
    }
    return list;
  }

  static boolean hasText(final String value) {
    return value != null && !value.trim().isEmpty();
  }

  /**
   * Code fragments spanning several lines read best as literal blocks.
   */
  private static final class LiteralBlockRepresenter extends Representer {
    private LiteralBlockRepresenter(final DumperOptions options) {
      super(options);
    }

    @Override
    protected Node representScalar(final Tag tag, final String value,
        final DumperOptions.ScalarStyle style) {
      if (Tag.STR.equals(tag) && value.indexOf('\n') >= 0) {
        return super.representScalar(tag, value, DumperOptions.ScalarStyle.LITERAL);
      }
      return super.representScalar(tag, value, style);
    }
  }

  private DocumentYaml() {}
}

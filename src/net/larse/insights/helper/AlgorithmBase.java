/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.insights.helper;

import com.google.common.base.Preconditions;

import java.io.IOException;
import java.io.InputStream;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;

/**
 * Base support for algorithm arguments.
 *
 * <p>Each algorithm declares a nested {@code Args} class whose public fields carry their own
 * defaults and are annotated with {@link ArgsBase.Doc} plus either {@link ArgsBase.Optional}
 * or {@link ArgsBase.Required}. Values can then be overridden from a {@link Properties} source
 * using {@code prefix.fieldName} keys.
 */
public final class AlgorithmBase {
  private AlgorithmBase() {}

  /**
   * Loads a properties resource from the classpath.
   *
   * @throws IllegalStateException if the resource is missing or unreadable
   */
  public static Properties loadProperties(String resource) {
    Properties props = new Properties();
    try (InputStream in = AlgorithmBase.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Missing configuration resource: " + resource);
      }
      props.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Couldn't read configuration resource: " + resource, e);
    }
    return props;
  }

  public abstract static class ArgsBase {
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Doc {
      String help();
    }

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Optional {}

    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    public @interface Required {}

    /**
     * Overrides the documented fields with values found under {@code prefix.fieldName}.
     * Keys that are absent keep the field default, unless the field is {@code @Required}.
     *
     * @throws IllegalArgumentException if a required key is missing or a value can't be parsed
     */
    public void load(Properties props, String prefix) {
      Preconditions.checkNotNull(props, "props");
      for (Field field : argFields()) {
        String key = prefix == null || prefix.isEmpty()
            ? field.getName()
            : prefix + "." + field.getName();
        String raw = props.getProperty(key);
        if (raw == null) {
          if (field.isAnnotationPresent(Required.class)) {
            throw new IllegalArgumentException("Missing required argument: " + key);
          }
          continue;
        }
        try {
          field.set(this, parse(field.getType(), raw.trim()));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException(
              String.format("Invalid value for %s: '%s'", key, raw), e);
        } catch (IllegalAccessException e) {
          // Args fields are public, so this should never happen.
          throw new IllegalStateException("Couldn't set argument " + key, e);
        }
      }
    }

    /** Help text for every documented argument, keyed by field name. */
    public Map<String, String> describe() {
      Map<String, String> help = new TreeMap<>();
      for (Field field : argFields()) {
        help.put(field.getName(), field.getAnnotation(Doc.class).help());
      }
      return help;
    }

    private Field[] argFields() {
      return Arrays.stream(getClass().getFields())
          .filter(f -> !Modifier.isStatic(f.getModifiers()) && !Modifier.isFinal(f.getModifiers()))
          .filter(f -> f.isAnnotationPresent(Doc.class))
          .toArray(Field[]::new);
    }

    private static Object parse(Class<?> type, String raw) {
      if (type == int.class || type == Integer.class) {
        return Integer.parseInt(raw);
      } else if (type == double.class || type == Double.class) {
        return Double.parseDouble(raw);
      } else if (type == long.class || type == Long.class) {
        return Long.parseLong(raw);
      } else if (type == boolean.class || type == Boolean.class) {
        return Boolean.parseBoolean(raw);
      } else if (type == String.class) {
        return raw;
      }
      throw new IllegalArgumentException("Unsupported argument type: " + type.getName());
    }
  }
}

/*
 * 
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *     http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package be.ugent.lbd.writer;

import be.ugent.lbd.ConfigurationException;
import be.ugent.lbd.geometry.GeometryLookup;
import be.ugent.lbd.schema.SchemaIdentifiers;
import be.ugent.lbd.schema.SchemaRegistry;

import java.time.Clock;
import java.util.Optional;

/**
 * Settings of a streaming conversion. Everything has a default, so
 * {@code ConversionOptions.builder().build()} is a valid configuration.
 */
public final class ConversionOptions {

  public static final String DEFAULT_BASE_URI = "http://linkedbuildingdata.net/ifc/resources/";
  public static final int DEFAULT_BUFFER_SIZE = 100000;

  private final ConverterType converter;
  private final FloatFormat floatFormat;
  private final int bufferSize;
  private final String baseUri;
  private final String defaultSchema;
  private final Clock clock;
  private final SchemaRegistry registry;
  private final Namespaces namespaces;
  private final GeometryLookup geometryLookup;

  private ConversionOptions(Builder builder) {
    this.converter = builder.converter;
    this.floatFormat = builder.floatFormat;
    this.bufferSize = builder.bufferSize;
    this.baseUri = builder.baseUri;
    this.defaultSchema = builder.defaultSchema;
    this.clock = builder.clock;
    this.registry = builder.registry;
    this.namespaces = builder.namespaces;
    this.geometryLookup = builder.geometryLookup;
  }

  public static Builder builder() {
    return new Builder();
  }

  public ConverterType getConverter() {
    return converter;
  }

  public FloatFormat getFloatFormat() {
    return floatFormat;
  }

  public int getBufferSize() {
    return bufferSize;
  }

  public String getBaseUri() {
    return baseUri;
  }

  public String getDefaultSchema() {
    return defaultSchema;
  }

  public Clock getClock() {
    return clock;
  }

  /**
   * @return a registry that replaces the bundled one, if set
   */
  public Optional<SchemaRegistry> getRegistry() {
    return Optional.ofNullable(registry);
  }

  /**
   * @return a namespace table that replaces the default one, if set
   */
  public Optional<Namespaces> getNamespaces() {
    return Optional.ofNullable(namespaces);
  }

  public Optional<GeometryLookup> getGeometryLookup() {
    return Optional.ofNullable(geometryLookup);
  }

  public static final class Builder {
    private ConverterType converter = ConverterType.MINI_IFCOWL_COMPLETE;
    private FloatFormat floatFormat = FloatFormat.SCIENTIFIC;
    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private String baseUri = DEFAULT_BASE_URI;
    private String defaultSchema = SchemaIdentifiers.DEFAULT_SCHEMA;
    private Clock clock = Clock.systemDefaultZone();
    private SchemaRegistry registry;
    private Namespaces namespaces;
    private GeometryLookup geometryLookup;

    private Builder() {
    }

    public Builder converter(ConverterType converter) {
      this.converter = converter;
      return this;
    }

    public Builder converter(String name) {
      this.converter = ConverterType.fromName(name);
      return this;
    }

    public Builder floatFormat(FloatFormat floatFormat) {
      this.floatFormat = floatFormat;
      return this;
    }

    public Builder floatFormat(String name) {
      this.floatFormat = FloatFormat.fromName(name);
      return this;
    }

    public Builder bufferSize(int bufferSize) {
      if (bufferSize < 1) {
        throw new ConfigurationException("Buffer size must be positive, got " + bufferSize);
      }
      this.bufferSize = bufferSize;
      return this;
    }

    public Builder baseUri(String baseUri) {
      if (baseUri == null || baseUri.isEmpty()) {
        throw new ConfigurationException("Base URI must not be empty");
      }
      this.baseUri = baseUri;
      return this;
    }

    public Builder defaultSchema(String defaultSchema) {
      this.defaultSchema = defaultSchema;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder registry(SchemaRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder namespaces(Namespaces namespaces) {
      this.namespaces = namespaces;
      return this;
    }

    public Builder geometryLookup(GeometryLookup geometryLookup) {
      this.geometryLookup = geometryLookup;
      return this;
    }

    public ConversionOptions build() {
      if (converter == null || floatFormat == null || clock == null) {
        throw new ConfigurationException("Converter, float format and clock are required");
      }
      return new ConversionOptions(this);
    }
  }
}

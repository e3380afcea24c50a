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

import be.ugent.lbd.model.AttributeValue;
import be.ugent.lbd.model.CollectionKind;
import be.ugent.lbd.schema.SchemaRegistry;
import org.apache.jena.atlas.lib.EscapeStr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Encodes attribute values as Turtle objects and counts the triples each
 * encoding produces.
 * <p>
 * Counting rules:
 * <ul>
 * <li>literal, reference, typed value: 1 (a typed value adds its auxiliary
 * statement to the entity context)</li>
 * <li>SET of n members: n, written as an object list</li>
 * <li>LIST or ARRAY of n members: 1 + 2n, written as an RDF collection</li>
 * <li>a nested collection of m members adds 2m to its container</li>
 * <li>an empty aggregate of any kind: 1, written as {@code ()}</li>
 * </ul>
 */
public class ValueEncoder {

  private static final Logger LOG = LoggerFactory.getLogger(ValueEncoder.class);

  private static final String EMPTY_COLLECTION = "()";

  private final SchemaRegistry registry;
  private final String modelPrefix;
  private final String instancePrefix;
  private final FloatFormat floatFormat;
  private final boolean referenceSetHeuristic;

  /**
   * @param modelPrefix    qname prefix of schema terms, including the colon
   * @param instancePrefix qname prefix of instances, including the colon
   */
  public ValueEncoder(SchemaRegistry registry, String modelPrefix, String instancePrefix, FloatFormat floatFormat,
                  ConverterType converter) {
    this.registry = registry;
    this.modelPrefix = modelPrefix;
    this.instancePrefix = instancePrefix;
    this.floatFormat = floatFormat;
    this.referenceSetHeuristic = converter.usesReferenceSetHeuristic();
  }

  public EncodedValue encodeAttribute(EntityEncodingContext context, String entityType, String attribute,
                  AttributeValue value) {
    return value.accept(new AttributeVisitor(context, entityType, attribute));
  }

  public String formatLiteral(AttributeValue.Literal literal) {
    switch (literal.getKind()) {
      case STRING:
        return '"' + EscapeStr.stringEsc(literal.stringValue()) + '"';
      case INTEGER:
        return "\"" + literal.longValue() + "\"^^xsd:integer";
      case FLOAT:
        return "\"" + floatFormat.format(literal.doubleValue()) + "\"^^xsd:double";
      case BOOLEAN:
        return "\"" + literal.booleanValue() + "\"^^xsd:boolean";
      default:
        throw new IllegalStateException("Unhandled literal kind " + literal.getKind());
    }
  }

  public String referenceIri(long targetId) {
    return instancePrefix + "ref_" + targetId;
  }

  // --------------------------------------
  // AGGREGATES
  // --------------------------------------

  private EncodedValue encodeCollection(EntityEncodingContext context, AttributeValue.Collection collection,
                  CollectionKind kind) {
    if (collection.isEmpty()) {
      return new EncodedValue(EMPTY_COLLECTION, 1);
    }
    List<String> members = new ArrayList<>(collection.size());
    long nested = 0;
    boolean allReferences = true;
    for (AttributeValue item : collection.getItems()) {
      EncodedValue member = item.accept(new MemberVisitor(context));
      members.add(member.getText());
      nested += member.getTriples();
      allReferences &= item instanceof AttributeValue.Reference;
    }

    CollectionKind resolved = kind;
    if (kind == CollectionKind.UNKNOWN || kind == CollectionKind.NONE) {
      resolved = referenceSetHeuristic && allReferences ? CollectionKind.SET : CollectionKind.LIST;
      if (LOG.isTraceEnabled()) {
        LOG.trace("unresolved aggregate of #{} written as {}", context.getEntityId(), resolved);
      }
    }
    long n = members.size();
    if (resolved == CollectionKind.SET) {
      return new EncodedValue(String.join(", ", members), n + 2 * nested);
    }
    return new EncodedValue("( " + String.join(" ", members) + " )", 1 + 2 * n + 2 * nested);
  }

  /**
   * Aggregate inside an aggregate (or inside a typed value). Always written as
   * an RDF collection; the count returned is the number of list nodes, each of
   * which costs two triples in the container.
   */
  private EncodedValue encodeNestedList(EntityEncodingContext context, AttributeValue.Collection collection) {
    if (collection.isEmpty()) {
      return new EncodedValue(EMPTY_COLLECTION, 0);
    }
    List<String> members = new ArrayList<>(collection.size());
    long nodes = collection.size();
    for (AttributeValue item : collection.getItems()) {
      EncodedValue member = item.accept(new MemberVisitor(context));
      members.add(member.getText());
      nodes += member.getTriples();
    }
    return new EncodedValue("( " + String.join(" ", members) + " )", nodes);
  }

  // --------------------------------------
  // TYPED VALUES
  // --------------------------------------

  private String encodeTypedValue(EntityEncodingContext context, AttributeValue.TypedValue typedValue) {
    int slot = context.reserve();
    String iri = context.typedValueIri(slot);
    AttributeValue inner = typedValue.getInner();

    String object;
    long triples;
    if (inner instanceof AttributeValue.Collection) {
      EncodedValue list = encodeNestedList(context, (AttributeValue.Collection) inner);
      object = list.getText();
      triples = 1 + 2 * list.getTriples();
    } else {
      object = inner.accept(new MemberVisitor(context)).getText();
      triples = 1;
    }
    context.complete(slot, iri + " " + modelPrefix + typedValue.getDeclaredType() + " " + object + " .\n", triples);
    if (LOG.isTraceEnabled()) {
      LOG.trace("typed value {} for {}", iri, typedValue);
    }
    return iri;
  }

  private final class AttributeVisitor implements AttributeValue.Visitor<EncodedValue> {
    private final EntityEncodingContext context;
    private final String entityType;
    private final String attribute;

    private AttributeVisitor(EntityEncodingContext context, String entityType, String attribute) {
      this.context = context;
      this.entityType = entityType;
      this.attribute = attribute;
    }

    @Override
    public EncodedValue visitLiteral(AttributeValue.Literal literal) {
      return new EncodedValue(formatLiteral(literal), 1);
    }

    @Override
    public EncodedValue visitReference(AttributeValue.Reference reference) {
      return new EncodedValue(referenceIri(reference.getTargetId()), 1);
    }

    @Override
    public EncodedValue visitTypedValue(AttributeValue.TypedValue typedValue) {
      return new EncodedValue(encodeTypedValue(context, typedValue), 1);
    }

    @Override
    public EncodedValue visitCollection(AttributeValue.Collection collection) {
      CollectionKind kind = registry.collectionKind(entityType, attribute);
      if (kind == CollectionKind.NONE) {
        kind = collection.getKind();
      }
      return encodeCollection(context, collection, kind);
    }
  }

  /**
   * Members of aggregates: the text of the member and, for nested aggregates,
   * the number of list nodes it adds.
   */
  private final class MemberVisitor implements AttributeValue.Visitor<EncodedValue> {
    private final EntityEncodingContext context;

    private MemberVisitor(EntityEncodingContext context) {
      this.context = context;
    }

    @Override
    public EncodedValue visitLiteral(AttributeValue.Literal literal) {
      return new EncodedValue(formatLiteral(literal), 0);
    }

    @Override
    public EncodedValue visitReference(AttributeValue.Reference reference) {
      return new EncodedValue(referenceIri(reference.getTargetId()), 0);
    }

    @Override
    public EncodedValue visitTypedValue(AttributeValue.TypedValue typedValue) {
      return new EncodedValue(encodeTypedValue(context, typedValue), 0);
    }

    @Override
    public EncodedValue visitCollection(AttributeValue.Collection collection) {
      return encodeNestedList(context, collection);
    }
  }
}

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
package be.ugent.lbd.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Value of a single entity attribute. The four variants are closed: code that
 * needs to tell them apart goes through {@link Visitor}.
 */
public abstract class AttributeValue {

    AttributeValue() {
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public interface Visitor<R> {
        R visitLiteral(Literal literal);

        R visitReference(Reference reference);

        R visitTypedValue(TypedValue typedValue);

        R visitCollection(Collection collection);
    }

    public enum LiteralKind {
        STRING,
        INTEGER,
        FLOAT,
        BOOLEAN
    }

    public static Literal string(String value) {
        return new Literal(LiteralKind.STRING, Objects.requireNonNull(value));
    }

    public static Literal integer(long value) {
        return new Literal(LiteralKind.INTEGER, value);
    }

    public static Literal real(double value) {
        return new Literal(LiteralKind.FLOAT, value);
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralKind.BOOLEAN, value);
    }

    public static Reference reference(long targetId) {
        return new Reference(targetId);
    }

    public static TypedValue typed(String declaredType, AttributeValue inner) {
        return new TypedValue(declaredType, inner);
    }

    public static Collection collection(CollectionKind kind, List<? extends AttributeValue> items) {
        return new Collection(kind, items);
    }

    public static Collection collection(List<? extends AttributeValue> items) {
        return new Collection(CollectionKind.UNKNOWN, items);
    }

    public static final class Literal extends AttributeValue {
        private final LiteralKind kind;
        private final Object value;

        private Literal(LiteralKind kind, Object value) {
            this.kind = kind;
            this.value = value;
        }

        public LiteralKind getKind() {
            return kind;
        }

        public Object getValue() {
            return value;
        }

        public String stringValue() {
            return String.valueOf(value);
        }

        public long longValue() {
            return ((Number) value).longValue();
        }

        public double doubleValue() {
            return ((Number) value).doubleValue();
        }

        public boolean booleanValue() {
            return (Boolean) value;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLiteral(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Literal)) {
                return false;
            }
            Literal other = (Literal) o;
            return kind == other.kind && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, value);
        }

        @Override
        public String toString() {
            return kind + "(" + value + ")";
        }
    }

    public static final class Reference extends AttributeValue {
        private final long targetId;

        private Reference(long targetId) {
            this.targetId = targetId;
        }

        public long getTargetId() {
            return targetId;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReference(this);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Reference && ((Reference) o).targetId == targetId;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(targetId);
        }

        @Override
        public String toString() {
            return "#" + targetId;
        }
    }

    /**
     * A value that carries its declared type explicitly, as SELECT attributes
     * do (e.g. {@code IfcLabel('Oak')} in a {@code IfcValue} slot).
     */
    public static final class TypedValue extends AttributeValue {
        private final String declaredType;
        private final AttributeValue inner;

        private TypedValue(String declaredType, AttributeValue inner) {
            this.declaredType = Objects.requireNonNull(declaredType);
            this.inner = Objects.requireNonNull(inner);
        }

        public String getDeclaredType() {
            return declaredType;
        }

        public AttributeValue getInner() {
            return inner;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitTypedValue(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof TypedValue)) {
                return false;
            }
            TypedValue other = (TypedValue) o;
            return declaredType.equals(other.declaredType) && inner.equals(other.inner);
        }

        @Override
        public int hashCode() {
            return Objects.hash(declaredType, inner);
        }

        @Override
        public String toString() {
            return declaredType + "(" + inner + ")";
        }
    }

    public static final class Collection extends AttributeValue {
        private final CollectionKind kind;
        private final List<AttributeValue> items;

        private Collection(CollectionKind kind, List<? extends AttributeValue> items) {
            this.kind = Objects.requireNonNull(kind);
            this.items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        public CollectionKind getKind() {
            return kind;
        }

        public List<AttributeValue> getItems() {
            return items;
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }

        public int size() {
            return items.size();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCollection(this);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof Collection)) {
                return false;
            }
            Collection other = (Collection) o;
            return kind == other.kind && items.equals(other.items);
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, items);
        }

        @Override
        public String toString() {
            return kind + items.toString();
        }
    }
}

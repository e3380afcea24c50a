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
package be.ugent.lbd.geometry;

import java.util.Objects;

/**
 * One triple of a geometry subgraph with every term already rendered as
 * Turtle text.
 */
public final class SubgraphTriple {

    private final String subject;
    private final String predicate;
    private final String object;

    public SubgraphTriple(String subject, String predicate, String object) {
        this.subject = subject;
        this.predicate = predicate;
        this.object = object;
    }

    public String getSubject() {
        return subject;
    }

    public String getPredicate() {
        return predicate;
    }

    public String getObject() {
        return object;
    }

    public String toTurtle() {
        return subject + " " + predicate + " " + object + " .\n";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SubgraphTriple)) {
            return false;
        }
        SubgraphTriple that = (SubgraphTriple) o;
        return subject.equals(that.subject) && predicate.equals(that.predicate) && object.equals(that.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, predicate, object);
    }

    @Override
    public String toString() {
        return subject + " " + predicate + " " + object;
    }
}

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

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Lexical form used for xsd:double literals.
 */
public enum FloatFormat {
  /** 15 digit mantissa, exponent without '+' or leading zeros: 5.840000000000000E-1 */
  SCIENTIFIC,
  /** plain decimal notation: 0.584 */
  PLAIN;

  private static final long NEGATIVE_ZERO_BITS = Double.doubleToRawLongBits(-0.0);

  public String format(double value) {
    if (Double.isNaN(value)) {
      return "NaN";
    }
    if (Double.isInfinite(value)) {
      return value > 0 ? "INF" : "-INF";
    }
    if (this == PLAIN) {
      if (Double.doubleToRawLongBits(value) == NEGATIVE_ZERO_BITS) {
        return "-0.0";
      }
      String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
      return plain.indexOf('.') < 0 ? plain + ".0" : plain;
    }
    String s = String.format(Locale.ROOT, "%.15E", value);
    return s.replace("E+", "E").replace("E-0", "E-").replace("E0", "E");
  }

  public static FloatFormat fromName(String name) {
    if (name != null) {
      for (FloatFormat format : values()) {
        if (format.name().equalsIgnoreCase(name.trim())) {
          return format;
        }
      }
    }
    throw new ConfigurationException("Unknown float format '" + name + "'. Available: scientific, plain");
  }
}

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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rounding of the coordinates inside WKT literals.
 */
public final class WktLiterals {

    public static final int DEFAULT_DIGITS = 6;

    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private WktLiterals() {
    }

    /**
     * Rounds every number to the given number of decimals and strips trailing
     * zeros and points. Negative zero becomes 0.
     */
    public static String round(String wkt, int digits) {
        Matcher m = NUMBER.matcher(wkt);
        StringBuilder sb = new StringBuilder(wkt.length());
        while (m.find()) {
            m.appendReplacement(sb, Matcher.quoteReplacement(roundNumber(m.group(), digits)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    public static String round(String wkt) {
        return round(wkt, DEFAULT_DIGITS);
    }

    static String roundNumber(String number, int digits) {
        double value = Double.parseDouble(number);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return number;
        }
        String s = new BigDecimal(value).setScale(digits, RoundingMode.HALF_EVEN).toPlainString();
        if (s.indexOf('.') >= 0) {
            int end = s.length();
            while (end > 0 && s.charAt(end - 1) == '0') {
                end--;
            }
            if (end > 0 && s.charAt(end - 1) == '.') {
                end--;
            }
            s = s.substring(0, end);
        }
        return s.isEmpty() || "-0".equals(s) ? "0" : s;
    }
}

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

import java.util.Locale;

/**
 * Conversion between 128 bit GUIDs written as 32 hex digits and the 22
 * character base64 form used by IFC GlobalId attributes.
 */
public final class IfcGuid {

    private static final String CHARS = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz_$";

    private IfcGuid() {
    }

    /**
     * @param hex 32 hex digits, dashes allowed
     * @return the 22 character compressed GUID
     */
    public static String compress(String hex) {
        String digits = hex.replace("-", "");
        if (digits.length() != 32) {
            throw new IllegalArgumentException("Expected 32 hex digits: '" + hex + "'");
        }
        int[] bytes = new int[16];
        for (int i = 0; i < 16; i++) {
            int hi = Character.digit(digits.charAt(2 * i), 16);
            int lo = Character.digit(digits.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Not a hex GUID: '" + hex + "'");
            }
            bytes[i] = hi << 4 | lo;
        }
        StringBuilder sb = new StringBuilder(22);
        appendBase64(sb, bytes[0], 2);
        for (int i = 1; i < 16; i += 3) {
            appendBase64(sb, (bytes[i] << 16) + (bytes[i + 1] << 8) + bytes[i + 2], 4);
        }
        return sb.toString();
    }

    /**
     * @return the 32 lowercase hex digits of a compressed GUID
     */
    public static String expand(String guid) {
        if (guid.length() != 22) {
            throw new IllegalArgumentException("Expected 22 characters: '" + guid + "'");
        }
        StringBuilder sb = new StringBuilder(32);
        sb.append(String.format(Locale.ROOT, "%02x", decode(guid, 0, 2)));
        for (int i = 2; i < 22; i += 4) {
            sb.append(String.format(Locale.ROOT, "%06x", decode(guid, i, i + 4)));
        }
        return sb.toString();
    }

    private static void appendBase64(StringBuilder sb, int value, int length) {
        char[] out = new char[length];
        for (int i = length - 1; i >= 0; i--) {
            out[i] = CHARS.charAt(value % 64);
            value /= 64;
        }
        sb.append(out);
    }

    private static int decode(String guid, int from, int to) {
        int value = 0;
        for (int i = from; i < to; i++) {
            int digit = CHARS.indexOf(guid.charAt(i));
            if (digit < 0) {
                throw new IllegalArgumentException("Invalid GUID character '" + guid.charAt(i) + "' in " + guid);
            }
            value = value * 64 + digit;
        }
        if ((to - from == 2 && value > 0xff) || value > 0xffffff) {
            throw new IllegalArgumentException("GUID out of range: " + guid);
        }
        return value;
    }
}

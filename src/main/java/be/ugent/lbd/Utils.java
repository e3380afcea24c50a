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
package be.ugent.lbd;

import java.text.CharacterIterator;
import java.text.StringCharacterIterator;
import java.util.Locale;

public class Utils {

    private Utils() {
    }

    // https://stackoverflow.com/questions/3758606/how-can-i-convert-byte-size-into-a-human-readable-format-in-java
    public static String humanReadableByteCountSI(long bytes) {
        if (-1000 < bytes && bytes < 1000) {
            return bytes + " B";
        }
        CharacterIterator ci = new StringCharacterIterator("kMGTPE");
        while (bytes <= -999_950 || bytes >= 999_950) {
            bytes /= 1000;
            ci.next();
        }
        return String.format(Locale.ROOT, "%.1f %cB", bytes / 1000.0, ci.current());
    }

    /**
     * Swaps the extension of an input file name for {@code .ttl}.
     */
    public static String turtleFileName(String inputFile) {
        int dot = inputFile.lastIndexOf('.');
        int slash = Math.max(inputFile.lastIndexOf('/'), inputFile.lastIndexOf('\\'));
        return (dot > slash ? inputFile.substring(0, dot) : inputFile) + ".ttl";
    }
}

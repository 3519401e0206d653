package com.swearguard.bot.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in glyph data. Letters are registered before digits, which fixes how ambiguous glyphs
 * such as {@code *} or {@code |} resolve in the normalization map.
 */
final class DefaultGlyphs {
    private static final int MATH_UPPER_A = 0x1D400;
    private static final int MATH_LOWER_A = 0x1D41A;
    private static final int MATH_ALPHABET_STYLES = 13;
    private static final int MATH_BOLD_ZERO = 0x1D7CE;
    private static final int MATH_DIGIT_STYLES = 5;

    // Single code point letter forms, indexed by the offset of 'a'.
    private static final int[] LETTER_BLOCKS = {
            0x24B6, // circled capital
            0x24D0, // circled small
            0x249C, // parenthesized small
            0xFF21, // fullwidth capital
            0xFF41, // fullwidth small
            0x1F110, // parenthesized capital
            0x1F130, // squared capital
            0x1F150, // negative circled capital
            0x1F170, // negative squared capital
            0x1F1E6 // regional indicator
    };

    private static final String[][] LETTERS = {
            {"a", "@", "4", "*", "α", "λ", "à", "á", "â", "ã", "ä", "å", "ā", "ă", "ą", "ɐ", "ɑ", "Д", "/\\"},
            {"b", "8", "6", "*", "β", "ß", "ḃ", "ḅ", "ḇ", "ɓ", "ь", "Ь", "|3"},
            {"c", "(", "<", "*", "ç", "ć", "ĉ", "ċ", "č", "¢", "ɔ", "©"},
            {"d", "|)", "ď", "đ", "ð", "ɖ", "ԁ"},
            {"e", "3", "*", "€", "ε", "è", "é", "ê", "ë", "ē", "ĕ", "ė", "ę", "ě", "ɘ", "£", "є", "ё"},
            {"f", "ƒ", "ʄ", "ꜰ"},
            {"g", "9", "ĝ", "ğ", "ġ", "ģ", "ɡ", "ɢ"},
            {"h", "#", "ĥ", "ħ", "ɦ", "н", "|-|"},
            {"i", "1", "!", "|", "*", "ι", "ì", "í", "î", "ï", "ĩ", "ī", "ĭ", "į", "ı", "ɨ", "¡", "і"},
            {"j", "ĵ", "ʝ", "ј"},
            {"k", "κ", "ķ", "ĸ", "к", "|<"},
            {"l", "|", "1", "*", "ĺ", "ļ", "ľ", "ŀ", "ł", "ɭ", "£", "ӏ"},
            {"m", "ɱ", "м", "^^", "|\\/|"},
            {"n", "ñ", "ń", "ņ", "ň", "ŉ", "ɲ", "η", "|\\|"},
            {"o", "0", "*", "()", "ο", "ò", "ó", "ô", "õ", "ö", "ø", "ō", "ŏ", "ő", "ɵ", "θ", "°", "о", "σ"},
            {"p", "ƥ", "ρ", "р", "þ"},
            {"q", "ʠ", "ϙ", "ԛ"},
            {"r", "ŕ", "ŗ", "ř", "ɹ", "я", "Я"},
            {"s", "5", "$", "*", "ś", "ŝ", "ş", "š", "ſ", "ꜱ", "ʂ", "§", "ѕ"},
            {"t", "7", "+", "*", "τ", "ţ", "ť", "ŧ", "ʈ", "†", "т"},
            {"u", "@", "v", "*", "υ", "ù", "ú", "û", "ü", "ũ", "ū", "ŭ", "ů", "ű", "ų", "µ", "|_|"},
            {"v", "u", "*", "ѵ", "ν", "\\/"},
            {"w", "vv", "uu", "ω", "ŵ", "ш", "\\/\\/"},
            {"x", "*", "×", "χ", "ж", "х", "><"},
            {"y", "ý", "ÿ", "ŷ", "ɣ", "у", "¥", "γ"},
            {"z", "2", "*", "ź", "ż", "ž", "ʐ", "ƶ"}
    };

    private static final String[][] DIGITS = {
            {"0", "o", "O", "()", "°", "⁰", "₀", "⓪", "⓿"},
            {"1", "i", "I", "l", "!", "|", "¹", "₁", "①", "⑴", "⒈", "❶"},
            {"2", "z", "Z", "²", "₂", "②", "⑵", "⒉", "❷"},
            {"3", "e", "E", "³", "₃", "③", "⑶", "⒊", "❸"},
            {"4", "a", "A", "@", "⁴", "₄", "④", "⑷", "⒋", "❹"},
            {"5", "s", "S", "$", "⁵", "₅", "⑤", "⑸", "⒌", "❺"},
            {"6", "b", "B", "⁶", "₆", "⑥", "⑹", "⒍", "❻"},
            {"7", "t", "T", "+", "⁷", "₇", "⑦", "⑺", "⒎", "❼"},
            {"8", "b", "B", "⁸", "₈", "⑧", "⑻", "⒏", "❽"},
            {"9", "g", "G", "q", "⁹", "₉", "⑨", "⑼", "⒐", "❾"}
    };

    private DefaultGlyphs() {
    }

    static SubstitutionTable substitutions() {
        SubstitutionTable.Builder builder = SubstitutionTable.builder();
        for (int offset = 0; offset < LETTERS.length; offset++) {
            char canonical = (char) ('a' + offset);
            builder.add(canonical, LETTERS[offset]);
            for (int block : LETTER_BLOCKS) {
                builder.addCodePoints(canonical, block + offset);
            }
            for (int style = 0; style < MATH_ALPHABET_STYLES; style++) {
                builder.addCodePoints(canonical,
                        MATH_UPPER_A + style * 52 + offset,
                        MATH_LOWER_A + style * 52 + offset);
            }
        }
        addLetterlikeSymbols(builder);
        for (int digit = 0; digit < DIGITS.length; digit++) {
            char canonical = (char) ('0' + digit);
            builder.add(canonical, DIGITS[digit]);
            builder.addCodePoints(canonical, 0xFF10 + digit);
            for (int style = 0; style < MATH_DIGIT_STYLES; style++) {
                builder.addCodePoints(canonical, MATH_BOLD_ZERO + style * 10 + digit);
            }
        }
        // l and I are read for each other in both directions; normalization keeps i->i and l->l.
        builder.addAlias('i', "l", "L");
        builder.addAlias('l', "i", "I");
        return builder.build();
    }

    // Letterlike block characters that fill the holes of the styled math alphabets.
    private static void addLetterlikeSymbols(SubstitutionTable.Builder builder) {
        builder.add('b', "ℬ");
        builder.add('c', "ℂ", "ℭ");
        builder.add('e', "ℯ", "ℰ");
        builder.add('f', "ℱ");
        builder.add('g', "ℊ");
        builder.add('h', "ℋ", "ℌ", "ℍ", "ℎ");
        builder.add('i', "ℐ", "ℑ");
        builder.add('l', "ℒ");
        builder.add('m', "ℳ");
        builder.add('n', "ℕ");
        builder.add('o', "ℴ");
        builder.add('p', "ℙ");
        builder.add('q', "ℚ");
        builder.add('r', "ℛ", "ℜ", "ℝ");
        builder.add('z', "ℤ", "ℨ");
    }

    static Map<Integer, Character> homoglyphs() {
        Map<Integer, Character> homoglyphs = new LinkedHashMap<>();
        // Cyrillic
        put(homoglyphs, "а", 'a');
        put(homoglyphs, "с", 'c');
        put(homoglyphs, "ԁ", 'd');
        put(homoglyphs, "е", 'e');
        put(homoglyphs, "һ", 'h');
        put(homoglyphs, "н", 'h');
        put(homoglyphs, "і", 'i');
        put(homoglyphs, "ј", 'j');
        put(homoglyphs, "к", 'k');
        put(homoglyphs, "ӏ", 'l');
        put(homoglyphs, "о", 'o');
        put(homoglyphs, "р", 'p');
        put(homoglyphs, "ԛ", 'q');
        put(homoglyphs, "ѕ", 's');
        put(homoglyphs, "т", 't');
        put(homoglyphs, "х", 'x');
        put(homoglyphs, "у", 'y');
        put(homoglyphs, "ғ", 'f');
        put(homoglyphs, "А", 'a');
        put(homoglyphs, "В", 'b');
        put(homoglyphs, "Е", 'e');
        put(homoglyphs, "К", 'k');
        put(homoglyphs, "М", 'm');
        put(homoglyphs, "Н", 'h');
        put(homoglyphs, "О", 'o');
        put(homoglyphs, "Р", 'p');
        put(homoglyphs, "С", 'c');
        put(homoglyphs, "Т", 't');
        put(homoglyphs, "Х", 'x');
        // Greek
        put(homoglyphs, "α", 'a');
        put(homoglyphs, "ε", 'e');
        put(homoglyphs, "ι", 'i');
        put(homoglyphs, "κ", 'k');
        put(homoglyphs, "ν", 'v');
        put(homoglyphs, "ο", 'o');
        put(homoglyphs, "ρ", 'p');
        put(homoglyphs, "τ", 't');
        put(homoglyphs, "υ", 'u');
        put(homoglyphs, "χ", 'x');
        // Latin small capitals and IPA
        put(homoglyphs, "ᴀ", 'a');
        put(homoglyphs, "ʙ", 'b');
        put(homoglyphs, "ᴄ", 'c');
        put(homoglyphs, "ᴅ", 'd');
        put(homoglyphs, "ᴇ", 'e');
        put(homoglyphs, "ꜰ", 'f');
        put(homoglyphs, "ɢ", 'g');
        put(homoglyphs, "ʜ", 'h');
        put(homoglyphs, "ɪ", 'i');
        put(homoglyphs, "ᴊ", 'j');
        put(homoglyphs, "ᴋ", 'k');
        put(homoglyphs, "ʟ", 'l');
        put(homoglyphs, "ᴍ", 'm');
        put(homoglyphs, "ɴ", 'n');
        put(homoglyphs, "ᴏ", 'o');
        put(homoglyphs, "ᴘ", 'p');
        put(homoglyphs, "ǫ", 'q');
        put(homoglyphs, "ʀ", 'r');
        put(homoglyphs, "ꜱ", 's');
        put(homoglyphs, "ᴛ", 't');
        put(homoglyphs, "ᴜ", 'u');
        put(homoglyphs, "ᴠ", 'v');
        put(homoglyphs, "ᴡ", 'w');
        put(homoglyphs, "ʏ", 'y');
        put(homoglyphs, "ᴢ", 'z');
        return homoglyphs;
    }

    private static void put(Map<Integer, Character> homoglyphs, String glyph, char latin) {
        homoglyphs.put(glyph.codePointAt(0), latin);
    }
}

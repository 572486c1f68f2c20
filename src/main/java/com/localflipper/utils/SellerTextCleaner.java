package com.localflipper.utils;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

import java.util.regex.Pattern;

/**
 * 模块说明：SellerTextCleaner（class）。
 * 主要职责：将卖家原始描述（可能含 HTML、表情符号、重复标点）整理为可供关键词规则匹配的纯文本。
 * 使用建议：规则只做清洗不做改写，避免影响成色与卖家信誉的关键词命中。
 */
public final class SellerTextCleaner {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\n\t]]");
    private static final Pattern EMOJI = Pattern.compile("[\\x{1F000}-\\x{1FAFF}\\x{2600}-\\x{27BF}\\x{FE0F}\\x{200D}]");
    private static final Pattern REPEATED_PUNCT = Pattern.compile("([!?.*~=_\\-])\\1{2,}");
    private static final Pattern SPACES = Pattern.compile("[ \t\\x{00A0}]+");
    private static final Pattern MULTI_BLANK = Pattern.compile("\n{3,}");

    private SellerTextCleaner() {
    }

    public static String clean(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        String t = raw.replace("\r\n", "\n").replace("\r", "\n");
        if (t.indexOf('<') >= 0) {
            t = toPlainText(t);
        }
        t = EMOJI.matcher(t).replaceAll("");
        t = CONTROL_CHARS.matcher(t).replaceAll("");
        // "!!!!" -> "!", "-----" -> "-"
        t = REPEATED_PUNCT.matcher(t).replaceAll("$1");
        t = SPACES.matcher(t).replaceAll(" ");
        t = t.replaceAll(" *\n *", "\n");
        t = MULTI_BLANK.matcher(t).replaceAll("\n\n");
        return t.trim();
    }

    private static String toPlainText(String html) {
        Document doc = Jsoup.parse(html);
        doc.outputSettings().prettyPrint(false);
        doc.select("br").append("\\n");
        doc.select("p,div,li,ul,ol,h1,h2,h3,h4,h5,h6").prepend("\\n");
        return doc.text().replace("\\n", "\n");
    }
}

package org.fmtguard.diagnostics;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import org.fmtguard.lexer.SourceText;
import org.fmtguard.lexer.Span;

/**
 * Machine-readable export of {@link SourceErrors} for editors and CI annotations.
 * <p>
 * Offsets are character offsets into the source; lines and columns are 1-based.
 */
public final class JsonDiagnostics {

    private JsonDiagnostics() {
    }

    public static String encode(SourceErrors errors, boolean indent) {
        JSONWriter.Feature[] features = indent ? new JSONWriter.Feature[]{JSONWriter.Feature.PrettyFormat} : new JSONWriter.Feature[0];
        return JSON.toJSONString(toJson(errors), features);
    }

    public static JSONObject toJson(SourceErrors errors) {
        JSONObject json = new JSONObject();
        json.put("file", errors.getFileName());
        json.put("message", errors.getMessage());
        JSONArray list = new JSONArray();
        for (FormatError error : errors.getErrors()) {
            list.add(toJson(error, errors.getSource()));
        }
        json.put("errors", list);
        return json;
    }

    static JSONObject toJson(FormatError error, SourceText source) {
        JSONObject json = new JSONObject();
        json.put("kind", error.kind().name());
        json.put("message", error.message());
        JSONArray labels = new JSONArray();
        for (Label label : error.labels()) {
            Span span = label.span();
            JSONObject item = new JSONObject();
            item.put("start", span.start());
            item.put("end", span.end());
            item.put("line", source.lineNumber(span.start()));
            item.put("column", source.columnNumber(span.start()));
            item.put("text", label.text());
            labels.add(item);
        }
        json.put("labels", labels);
        if (error.help() != null) {
            json.put("help", error.help());
        }
        return json;
    }
}

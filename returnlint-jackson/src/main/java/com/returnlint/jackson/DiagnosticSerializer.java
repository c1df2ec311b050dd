package com.returnlint.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.returnlint.Diagnostic;
import com.returnlint.ast.SourceLocation;

import java.io.IOException;

/**
 * Writes a diagnostic as one flat object:
 * {@code {"line":2,"column":3,"end_line":2,"end_column":15,"type":"style","message":"...","linter":"return_linter"}}.
 */
public class DiagnosticSerializer extends JsonSerializer<Diagnostic> {
    @Override
    public void serialize(Diagnostic value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        SourceLocation loc = value.loc() != null ? value.loc() : SourceLocation.NONE;
        gen.writeStartObject();
        gen.writeNumberField("line", loc.start().line());
        gen.writeNumberField("column", loc.start().column());
        gen.writeNumberField("end_line", loc.end().line());
        gen.writeNumberField("end_column", loc.end().column());
        gen.writeStringField("type", value.severity().label());
        gen.writeStringField("message", value.message());
        gen.writeStringField("linter", value.linter());
        gen.writeEndObject();
    }
}

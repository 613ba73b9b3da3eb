package com.witty.infrastructure.adapter.template;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only template cache shared by all requests.
 */
@Component
public class PromptTemplateRegistry {

    public static final String SEGMENT = "segment_v1";
    public static final String SYMBOLIZE = "symbolize_v1";

    private static final String SEGMENT_SCHEMA = """
            {"type":"object","required":["confidence","claims"],"properties":{
              "confidence":{"type":"number","minimum":0,"maximum":1},
              "claims":{"type":"array","minItems":1,"items":{"type":"object","required":["text","start","end"],"properties":{
                "text":{"type":"string"},
                "start":{"type":"integer"},
                "end":{"type":"integer"},
                "category":{"enum":["EVENT","RELATIONAL"]},
                "modal":{"enum":["NECESSITY","POSSIBILITY",null]},
                "presuppositions":{"type":"array","items":{"type":"string"}}}}}}}""";

    private static final String SYMBOLIZE_SCHEMA = """
            {"type":"object","required":["confidence","candidates"],"properties":{
              "confidence":{"type":"number","minimum":0,"maximum":1},
              "candidates":{"type":"array","items":{"type":"object","required":["ast"],"properties":{
                "ast":{"$ref":"#/definitions/node"},
                "confidence":{"type":"number","minimum":0,"maximum":1},
                "basis":{"type":"array","items":{"type":"string"}}}}}},
             "definitions":{"node":{"type":"object","required":["kind"],"properties":{
                "kind":{"enum":["ATOM","NOT","AND","OR","IMPLIES","IFF","MODAL"]},
                "symbol":{"type":"string"},
                "operator":{"enum":["NECESSITY","POSSIBILITY"]},
                "children":{"type":"array","items":{"$ref":"#/definitions/node"}}}}}}""";

    private final Map<String, PromptTemplate> templates = new LinkedHashMap<>();

    public PromptTemplateRegistry() {
        register(new PromptTemplate(SEGMENT, "1",
                """
                You split a statement into minimal atomic claims, assuming the statement is true.
                Return each claim with the character offsets [start, end) of the text it was taken from.
                Do not judge whether a claim is factually true. Expand presuppositions carried by quantifiers
                ("every", "some", "no") as additional claim texts of the claim that introduces them.""",
                "Statement:\n{input}",
                "The previous answer was not valid JSON for the schema or was not confident. "
                        + "Return only the JSON object, with offsets inside the statement.",
                SEGMENT_SCHEMA));

        register(new PromptTemplate(SYMBOLIZE, "1",
                """
                You propose propositional logical forms for a statement.
                Use only the given symbols as ATOM leaves. Wrap necessity or possibility in MODAL nodes.
                List in "basis" the claim identifiers each candidate was built from.""",
                "Statement:\n{input}\n\nSymbols:\n{context}",
                "The previous answer was not valid JSON for the schema or was not confident. "
                        + "Return only the JSON object and use only the listed symbols.",
                SYMBOLIZE_SCHEMA));
    }

    private void register(PromptTemplate template) {
        templates.put(template.id(), template);
    }

    public PromptTemplate get(String id) {
        PromptTemplate template = templates.get(id);
        if (template == null) {
            throw new IllegalArgumentException("Unknown prompt template: " + id);
        }
        return template;
    }

    public boolean contains(String id) {
        return templates.containsKey(id);
    }
}

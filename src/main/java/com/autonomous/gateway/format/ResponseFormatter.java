package com.autonomous.gateway.format;

import com.autonomous.gateway.model.ResponseFormat;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * Outbound prompt enhancement and inbound cleanup for structured response formats.
 * The template advertised by {@link #enhanceMessage} uses exactly the fields the
 * cleanup expects, and the fence markers it forbids are the ones the cleanup strips.
 */
@Slf4j
public class ResponseFormatter {

    public static final String INVALID_JSON = "Invalid JSON";
    public static final String INVALID_XML_PREFIX = "Invalid XML: ";

    static final String JSON_TEMPLATE = "{\n"
        + "  \"title\": \"short description of the request\",\n"
        + "  \"source_request\": \"the original request\",\n"
        + "  \"answer\": \"the answer to the request\"\n"
        + "}";

    static final String XML_TEMPLATE = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
        + "<response>\n"
        + "  <title>short description of the request</title>\n"
        + "  <source_request>the original request</source_request>\n"
        + "  <answer>the answer to the request</answer>\n"
        + "</response>";

    private final ObjectMapper objectMapper;

    public ResponseFormatter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String enhanceMessage(String userMessage, ResponseFormat format) {
        return switch (format) {
            case PLAIN_TEXT -> userMessage;
            case JSON -> enhanceForJson(userMessage);
            case XML -> enhanceForXml(userMessage);
        };
    }

    public String processResponse(String responseText, ResponseFormat format) {
        String text = responseText == null ? "" : responseText;
        return switch (format) {
            case PLAIN_TEXT -> text;
            case JSON -> processJson(text);
            case XML -> processXml(text);
        };
    }

    private String enhanceForJson(String userMessage) {
        return "User request: " + userMessage + "\n\n"
            + "CRITICAL: Respond ONLY with raw JSON. Your response must start with { and end with }\n\n"
            + "Required JSON format:\n"
            + JSON_TEMPLATE + "\n\n"
            + "STRICT RULES:\n"
            + "- NO markdown code blocks (NO ```json or ```)\n"
            + "- NO explanatory text before or after JSON\n"
            + "- NO additional formatting\n"
            + "- Start immediately with {\n"
            + "- End immediately with }\n"
            + "- Use only the keys: title, source_request, answer\n\n"
            + "WRONG examples (DO NOT do this):\n"
            + "```json\n{...}\n```\n\n"
            + "or\n\n"
            + "Here is the JSON:\n{...}\n\n"
            + "Your response must be pure JSON only.";
    }

    private String enhanceForXml(String userMessage) {
        return "User request: " + userMessage + "\n\n"
            + "CRITICAL: Respond ONLY with valid XML. Your response must start with <?xml and end with </response>\n\n"
            + "Required XML format:\n"
            + XML_TEMPLATE + "\n\n"
            + "STRICT RULES:\n"
            + "- NO markdown code blocks (NO ```xml or ```)\n"
            + "- NO explanatory text before or after XML\n"
            + "- NO additional formatting\n"
            + "- Must include XML declaration: <?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
            + "- Must be well-formed XML with proper opening and closing tags\n"
            + "- Use only the tags: <response>, <title>, <source_request>, <answer>\n\n"
            + "WRONG examples (DO NOT do this):\n"
            + "```xml\n<response>...</response>\n```\n\n"
            + "or\n\n"
            + "Here is the XML:\n<response>...</response>\n\n"
            + "Your response must be pure XML only.";
    }

    private String processJson(String responseText) {
        String cleaned = stripFence(responseText, "```json");
        try {
            JsonNode node = objectMapper.reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readTree(cleaned);
            if (node == null || node.isMissingNode()) {
                return INVALID_JSON;
            }
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
        } catch (Exception e) {
            log.debug("Response is not valid JSON: {}", e.getMessage());
            return INVALID_JSON;
        }
    }

    private String processXml(String responseText) {
        String cleaned = stripFence(responseText, "```xml");
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            Document document = factory.newDocumentBuilder().parse(new InputSource(new StringReader(cleaned)));

            removeWhitespaceNodes(document.getDocumentElement());

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");

            StringWriter writer = new StringWriter();
            transformer.transform(new DOMSource(document), new StreamResult(writer));
            return writer.toString();
        } catch (Exception e) {
            log.debug("Response is not valid XML: {}", e.getMessage());
            return INVALID_XML_PREFIX + e.getMessage();
        }
    }

    static String stripFence(String response, String languageFence) {
        String text = response.trim();
        if (text.startsWith(languageFence)) {
            text = text.substring(languageFence.length());
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        return text.trim();
    }

    private static void removeWhitespaceNodes(Node node) {
        List<Node> blank = new ArrayList<>();
        NodeList children = node.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.TEXT_NODE && child.getTextContent().isBlank()) {
                blank.add(child);
            } else if (child.getNodeType() == Node.ELEMENT_NODE) {
                removeWhitespaceNodes(child);
            }
        }
        blank.forEach(node::removeChild);
    }
}

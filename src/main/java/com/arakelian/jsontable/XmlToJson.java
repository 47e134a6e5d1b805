/*
 * Copyright 2012-2017 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.arakelian.jsontable;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.net.URL;

import javax.xml.XMLConstants;
import javax.xml.transform.Templates;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import javax.xml.transform.stream.StreamSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Node;

import com.google.common.base.Preconditions;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.io.Resources;

/**
 * Converts structured markup to JSON text with the bundled {@code xml-to-json.xsl} stylesheet.
 *
 * Elements whose children all share one name, and row set elements, become arrays; other elements
 * with children or attributes become objects, with attributes named {@code @name}; leaf text
 * becomes a number, boolean or string, and empty elements become {@code null}.
 */
public final class XmlToJson {
    private static final Logger LOGGER = LoggerFactory.getLogger(XmlToJson.class);

    private static final String STYLESHEET = "xml-to-json.xsl";

    private static final Supplier<Templates> TEMPLATES = Suppliers.memoize(XmlToJson::compile);

    private static Templates compile() {
        final URL url = Resources.getResource(XmlToJson.class, STYLESHEET);
        try (InputStream in = url.openStream()) {
            final TransformerFactory factory = TransformerFactory.newInstance();
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            final Templates templates = factory.newTemplates(new StreamSource(in, url.toExternalForm()));
            LOGGER.debug("Compiled {}", url);
            return templates;
        } catch (final IOException | TransformerConfigurationException e) {
            throw new IllegalStateException("Unable to compile " + STYLESHEET, e);
        }
    }

    /**
     * Returns the JSON text of the given node.
     *
     * @param node
     *            document or element
     * @return JSON text
     * @throws IOException
     *             if the transformation fails
     */
    public static String toJson(final Node node) throws IOException {
        return escapeText(transform(node));
    }

    static String transform(final Node node) throws IOException {
        Preconditions.checkNotNull(node);
        final StringWriter out = new StringWriter();
        try {
            final Transformer transformer = TEMPLATES.get().newTransformer();
            transformer.transform(new DOMSource(node), new StreamResult(out));
        } catch (final TransformerException e) {
            throw new IOException("Unable to convert XML to JSON", e);
        }
        return out.toString();
    }

    /**
     * Escapes control characters left in string values of the transformation result. The
     * stylesheet has already escaped backslash and double quote.
     */
    static String escapeText(final String transformed) {
        final StringBuilder buf = new StringBuilder(transformed.length() + 16);
        for (int i = 0, length = transformed.length(); i < length; i++) {
            final char ch = transformed.charAt(i);
            switch (ch) {
            case '\r':
                buf.append("\\r");
                break;
            case '\n':
                buf.append("\\n");
                break;
            case '\t':
                buf.append("\\t");
                break;
            default:
                if (ch < ' ') {
                    buf.append(String.format("\\u%04x", (int) ch));
                } else {
                    buf.append(ch);
                }
            }
        }
        return buf.toString();
    }

    private XmlToJson() {
        // utility class
    }
}

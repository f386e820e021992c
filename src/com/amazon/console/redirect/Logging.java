/*
 * Copyright 2014-2016 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Licensed under the Amazon Software License (the "License").
 * You may not use this file except in compliance with the License.
 * A copy of the License is located at
 *
 *  http://aws.amazon.com/asl/
 *
 * or in the "license" file accompanying this file.
 * This file is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and limitations under the License.
 */
package com.amazon.console.redirect;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Iterator;

import javax.xml.namespace.NamespaceContext;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;

import org.apache.log4j.Level;
import org.apache.log4j.xml.DOMConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

/**
 * Configures Log4j for the redirection tool and hands out SLF4J loggers.
 *
 * The bundled configuration writes to a size-rotated file appender named
 * {@code FILE}; its file name, backup count and size limit can be overridden
 * by the caller before the configuration is applied.
 */
public class Logging {
    static final String DEFAULT_CONFIG = "custom.log4j.xml";
    static final String FILE_APPENDER = "FILE";

    static class Log4JNamespaceContext implements NamespaceContext {
        static final String PREFIX = "log4j";
        static final String URI = "http://jakarta.apache.org/log4j/";

        @Override
        public String getNamespaceURI(String prefix) {
            return PREFIX.equals(prefix) ? URI : null;
        }

        @Override
        public String getPrefix(String uri) {
            return URI.equals(uri) ? PREFIX : null;
        }

        @Override
        public Iterator<String> getPrefixes(String uri) {
            return URI.equals(uri) ? Collections.singletonList(PREFIX).iterator()
                    : Collections.<String> emptyIterator();
        }
    }

    private static boolean initialized = false;

    public synchronized static boolean isInitialized() {
        return initialized;
    }

    public synchronized static void initialize(Path logFile, String logLevel, int maxBackupIndex, long maxFileSize)
            throws Exception {
        try (InputStream configStream = Logging.class.getResourceAsStream(DEFAULT_CONFIG)) {
            initialize(configStream, logFile, logLevel, maxBackupIndex, maxFileSize);
        }
    }

    /**
     * Applies the Log4j configuration read from {@code configStream}. Only the
     * first call in a process has any effect.
     *
     * @param configStream Log4j XML configuration.
     * @param logFile overrides the {@code FILE} appender's file, if not {@code null}.
     * @param logLevel root logger level, if not {@code null}.
     * @param maxBackupIndex overrides the number of rotated log files kept, if positive.
     * @param maxFileSize overrides the size at which the log is rotated, if positive.
     */
    public synchronized static void initialize(InputStream configStream, Path logFile, String logLevel,
            int maxBackupIndex, long maxFileSize) throws Exception {
        if (initialized)
            return;
        Preconditions.checkNotNull(configStream, "Logging configuration not found.");
        Document log4jconfig = getLog4JConfigurationDocument(configStream, logFile, maxBackupIndex, maxFileSize);
        DOMConfigurator.configure(log4jconfig.getDocumentElement());
        org.apache.log4j.Logger root = org.apache.log4j.Logger.getRootLogger();
        if (logLevel != null) {
            root.setLevel(Level.toLevel(logLevel));
        }

        String initError = CustomLog4jFallbackErrorHandler.getErrorHeader();
        if (initError != null) {
            root.error("\n" + initError);
        } else {
            // Log4j creates the fallback file eagerly
            Path fallbackLog = Paths.get(CustomLog4jFallbackErrorHandler.getFallbackLogFile());
            try {
                if (Files.exists(fallbackLog) && Files.size(fallbackLog) == 0)
                    Files.delete(fallbackLog);
            } catch (IOException e) {
                root.debug("Could not remove empty fallback log " + fallbackLog, e);
            }
        }
        initialized = true;
    }

    @VisibleForTesting
    static Document getLog4JConfigurationDocument(InputStream configStream, Path logFile, int maxBackupIndex,
            long maxFileSize) throws ParserConfigurationException, SAXException, IOException, XPathExpressionException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        DocumentBuilder builder = factory.newDocumentBuilder();
        Document log4jconfig = builder.parse(configStream);

        if (logFile != null) {
            setAppenderParameter(log4jconfig, FILE_APPENDER, "File", logFile.toString());
        }
        if (maxBackupIndex > 0) {
            setAppenderParameter(log4jconfig, FILE_APPENDER, "MaxBackupIndex", Integer.toString(maxBackupIndex));
        }
        if (maxFileSize > 0) {
            setAppenderParameter(log4jconfig, FILE_APPENDER, "MaxFileSize", Long.toString(maxFileSize));
        }
        return log4jconfig;
    }

    @VisibleForTesting
    static NodeList findAppenderParameter(Document log4jconfig, String appender, String parameter)
            throws XPathExpressionException {
        XPath xPath = XPathFactory.newInstance().newXPath();
        xPath.setNamespaceContext(new Log4JNamespaceContext());
        return (NodeList) xPath.evaluate(
                "/log4j:configuration/appender[@name='" + appender + "']/param[@name='" + parameter + "']",
                log4jconfig.getDocumentElement(), XPathConstants.NODESET);
    }

    private static void setAppenderParameter(Document log4jconfig, String appender, String parameter,
            String newValue) throws XPathExpressionException {
        NodeList nodes = findAppenderParameter(log4jconfig, appender, parameter);
        if (nodes.getLength() == 0) {
            throw new IllegalStateException(String.format(
                    "Appender %s has no parameter %s in the logging configuration.", appender, parameter));
        }
        ((Element) nodes.item(0)).setAttribute("value", newValue);
    }

    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }
}

package com.tyron.multicode.lang.java;

import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.util.JavacTask;
import com.sun.source.util.Trees;
import com.tyron.multicode.api.language.Lang;
import com.tyron.multicode.api.language.LanguageParser;
import com.tyron.multicode.api.language.ParsedSource;
import org.jetbrains.annotations.Nullable;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.io.StringWriter;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Parses Java sources with the JDK's own compiler front end.
 *
 * Only the parse phase runs, so unresolved symbols are fine and syntax errors are recovered from. All javac
 * access is serialized on this instance.
 */
public class JavaLanguageParser implements LanguageParser {

    private static final Logger LOG = Logger.getLogger(JavaLanguageParser.class.getName());

    private static final URI SOURCE_URI = URI.create("string:///Source.java");
    private static final List<String> OPTIONS = List.of("-proc:none", "-Xlint:none");

    private final Object lock = new Object();
    private StandardJavaFileManager fileManager;

    @Override
    public Lang lang() {
        return Lang.JAVA;
    }

    @Override
    public Optional<ParsedSource> parse(String text, @Nullable ParsedSource previous) {
        if (previous instanceof JavaParsedSource cached && cached.text().equals(text)) {
            return Optional.of(cached);
        }
        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            LOG.warning("No system Java compiler available; Java sources cannot be parsed");
            return Optional.empty();
        }

        synchronized (lock) {
            if (fileManager == null) {
                fileManager = compiler.getStandardFileManager(null, null, StandardCharsets.UTF_8);
            }
            JavaFileObject source = new SimpleJavaFileObject(SOURCE_URI, JavaFileObject.Kind.SOURCE) {
                @Override
                public CharSequence getCharContent(boolean ignoreEncodingErrors) {
                    return text;
                }
            };
            DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
            JavacTask task = (JavacTask) compiler.getTask(new StringWriter(), fileManager, diagnostics, OPTIONS,
                    null, List.of(source));
            try {
                Iterator<? extends CompilationUnitTree> units = task.parse().iterator();
                if (!units.hasNext()) {
                    LOG.warning("javac produced no compilation unit");
                    return Optional.empty();
                }
                CompilationUnitTree unit = units.next();
                int errors = 0;
                for (Diagnostic<? extends JavaFileObject> diagnostic : diagnostics.getDiagnostics()) {
                    if (diagnostic.getKind() == Diagnostic.Kind.ERROR) {
                        errors++;
                    }
                }
                if (errors > 0) {
                    LOG.fine(errors + " syntax errors in Java source");
                }
                return Optional.of(new JavaParsedSource(text, unit, Trees.instance(task).getSourcePositions(), errors));
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Failed to read in-memory Java source", e);
                return Optional.empty();
            }
        }
    }
}

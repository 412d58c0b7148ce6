package rulegen;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

import javax.lang.model.element.Modifier;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.ToolProvider;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.TypeSpec;
import com.sun.source.util.JavacTask;

/**
 * Assembles the generated methods into one class, checks that the result parses as Java, and
 * writes it under the output directory.
 */
public final class RewriteEmitter {
  private final RuntimeNames names;

  public RewriteEmitter(RuntimeNames names) {
    this.names = names;
  }

  public static String className(String archSuffix) {
    return "Rewrite" + archSuffix;
  }

  public JavaFile assemble(String rulesFileName, String archSuffix, Iterable<MethodSpec> methods) {
    TypeSpec type =
        TypeSpec.classBuilder(className(archSuffix))
            .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
            .addMethod(MethodSpec.constructorBuilder().addModifiers(Modifier.PRIVATE).build())
            .addMethods(methods)
            .build();
    return JavaFile.builder(names.packageName(), type)
        .addFileComment("autogenerated from $L: do not edit!\n", rulesFileName)
        .addFileComment("generated with: $L", RuleGenMain.class.getSimpleName())
        .skipJavaLangImports(true)
        .build();
  }

  /** Parses the generated source and fails on the first syntax error. */
  public void validate(JavaFile javaFile) throws CompilerException {
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    if (compiler == null) {
      throw new IllegalStateException("No system Java compiler; run with a JDK, not a JRE");
    }
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    JavacTask task =
        (JavacTask)
            compiler.getTask(
                null,
                null,
                diagnostics,
                ImmutableList.of("-proc:none"),
                null,
                ImmutableList.of(javaFile.toJavaFileObject()));
    try {
      task.parse();
    } catch (IOException ex) {
      throw new UncheckedIOException(ex);
    }

    String fileName = javaFile.typeSpec.name + ".java";
    List<String> lines = Splitter.on('\n').splitToList(javaFile.toString());
    for (Diagnostic<? extends JavaFileObject> diagnostic : diagnostics.getDiagnostics()) {
      if (diagnostic.getKind() != Diagnostic.Kind.ERROR) {
        continue;
      }
      int line = (int) diagnostic.getLineNumber();
      String source = line >= 1 && line <= lines.size() ? lines.get(line - 1).trim() : "";
      throw new CompilerException(
          new RuleReader.Pos(fileName, line),
          String.format(
              "generated code does not parse: %s: %s",
              diagnostic.getMessage(Locale.ROOT), source));
    }
  }

  /** Writes {@code javaFile} under {@code outputDir} following its package and returns the file. */
  public File write(JavaFile javaFile, File outputDir) throws IOException {
    File file =
        new File(
            new File(outputDir, javaFile.packageName.replace('.', File.separatorChar)),
            javaFile.typeSpec.name + ".java");
    Files.createParentDirs(file);
    Files.asCharSink(file, StandardCharsets.UTF_8).write(javaFile.toString());
    return file;
  }
}

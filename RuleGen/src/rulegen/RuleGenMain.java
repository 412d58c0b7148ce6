package rulegen;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;
import java.util.TreeMap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.io.Files;
import com.squareup.javapoet.JavaFile;

/**
 * Reads {@code <arch>.rules} for each registered architecture from the rules directory and writes
 * {@code Rewrite<Arch>.java} for each one under the output directory.
 */
public class RuleGenMain {

  private static final String USAGE =
      "Usage: $RULEGEN [-log] rules_dir output_dir package [arch...]";
  private static final String LOG_FLAG = "-log";
  private static final String RULES_SUFFIX = ".rules";

  public static void main(String[] args) throws IOException {
    boolean log = false;
    List<String> positional = new ArrayList<>();
    for (String arg : args) {
      if (arg.equals(LOG_FLAG)) {
        log = true;
      } else if (arg.startsWith("-")) {
        usage();
      } else {
        positional.add(arg);
      }
    }
    if (positional.size() < 3) {
      usage();
    }

    File rulesDir = new File(positional.get(0));
    File outputDir = new File(positional.get(1));
    RuleGen.Options options =
        RuleGen.Options.builder().setLog(log).setPackageName(positional.get(2)).build();

    ImmutableSortedMap<String, Arch> archs = loadArchs();
    Arch generic = archs.get(Arch.GENERIC);
    if (generic == null) {
      System.err.println("No ArchProvider supplies the generic ops.");
      System.exit(1);
    }

    ImmutableList<String> selected =
        positional.size() > 3
            ? ImmutableList.copyOf(positional.subList(3, positional.size()))
            : archs.keySet().asList();
    for (String name : selected) {
      Arch arch = archs.get(name);
      if (arch == null) {
        System.err.println(String.format("Unknown arch %s; known: %s", name, archs.keySet()));
        System.exit(1);
      }

      File rulesFile = new File(rulesDir, name + RULES_SUFFIX);
      if (!rulesFile.isFile()) {
        if (positional.size() > 3) {
          System.err.println("Missing rules file " + rulesFile);
          System.exit(1);
        }
        System.out.println("Skipping " + name + "; no " + rulesFile);
        continue;
      }
      RuleGen ruleGen = new RuleGen(new OpRegistry(generic, arch), options);
      try {
        JavaFile javaFile = ruleGen.generate(rulesFile.getName(), read(rulesFile));
        File written = ruleGen.emitter().write(javaFile, outputDir);
        System.out.println("Generated " + written);
      } catch (CompilerException ex) {
        ex.print();
        System.out.println("Generation failed.  See errors above.");
        System.exit(1);
      }
    }
  }

  static ImmutableSortedMap<String, Arch> loadArchs() {
    TreeMap<String, Arch> archs = new TreeMap<>();
    for (ArchProvider provider : ServiceLoader.load(ArchProvider.class)) {
      Arch arch = provider.arch();
      if (archs.put(arch.name(), arch) != null) {
        throw new IllegalStateException("Two providers for arch " + arch.name());
      }
    }
    return ImmutableSortedMap.copyOf(archs);
  }

  private static void usage() {
    System.err.println(USAGE);
    System.exit(1);
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}

package arrlit;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;

public class CompilerMain {

  private static final String SOURCE_EXTENSION = "al";

  public static void main(String[] args) throws CompilerException, IOException {
    if (args.length != 2) {
      System.err.println("Usage: $COMPILER source_file out_dir");
      System.exit(1);
    }

    File source = new File(args[0]);
    if (!source.isFile() || !Files.getFileExtension(source.getName()).equals(SOURCE_EXTENSION)) {
      System.err.println(String.format("Not a .%s file: %s", SOURCE_EXTENSION, source));
      System.exit(1);
    }

    // Parse.
    AST ast;
    try {
      ast = DeclarationParser.parse(source.getName(), read(source));
    } catch (CompilerException ex) {
      ex.print();
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
      return;
    }

    ASTValidator validator = new ASTValidator(ast);
    ImmutableList<CompilerException> errors = validator.computeErrors();
    if (!errors.isEmpty()) {
      errors.stream().forEach(CompilerException::print);
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }

    Compiler compiler = new Compiler(validator);
    compiler.compile();

    File outDir = new File(args[1]);
    String base = Files.getNameWithoutExtension(source.getName());
    File indexFile = new File(outDir, base + ".index");
    Files.createParentDirs(indexFile);
    Files.asByteSink(indexFile).write(compiler.indexFile());
    Files.asByteSink(new File(outDir, base + ".out")).write(compiler.outFile());

    System.out.println(
        String.format(
            "Compiled %d definitions to %s", validator.evaluationOrder().size(), outDir));
    System.out.println("Compilation succeeded!");
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}

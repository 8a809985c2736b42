package org.talkpp.compiler;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.talkpp.compiler.error.CompilationException;
import org.talkpp.compiler.error.CompilerError;
import org.talkpp.compiler.generator.CompilerConfig;
import org.talkpp.compiler.generator.OptimizationLevel;
import org.talkpp.compiler.generator.TargetLanguage;
import org.talkpp.compiler.tree.Statement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TalkCompilerTest {

    private static final String RULE = "if new user registers then validate email using SendGrid";

    // === Compilation ===

    @Test
    void compile_defaultConfig_producesRustWithBootstrap() throws CompilationException {
        var code = TalkCompiler.create().compile(RULE);

        assertThat(code).contains("pub async fn handler(event: Event)")
                        .contains("send_email_sendgrid(&event).await")
                        .contains("#[tokio::main]");
    }

    @Test
    void compile_builder_selectsTarget() throws CompilationException {
        var compiler = TalkCompiler.builder()
                                   .target(TargetLanguage.PYTHON)
                                   .optimization(OptimizationLevel.RELEASE)
                                   .debug(false)
                                   .build();

        assertEquals(new CompilerConfig(TargetLanguage.PYTHON, OptimizationLevel.RELEASE, false), compiler.config());
        assertThat(compiler.compile(RULE)).contains("async def handler(event: Event) -> Response:");
    }

    @Test
    void compile_lexicalFailure_propagates() {
        var exception = assertThrows(CompilationException.class, () -> TalkCompiler.create().compile("if @ invalid"));

        assertInstanceOf(CompilerError.LexicalError.class, exception.error());
    }

    @Test
    void compile_parseFailure_propagates() {
        var exception = assertThrows(CompilationException.class,
                                     () -> TalkCompiler.compile("if new user registers", CompilerConfig.DEFAULT));

        assertInstanceOf(CompilerError.ParseError.class, exception.error());
    }

    @Test
    void compileAndValidate_everyTarget_succeeds() throws CompilationException {
        for (var target : TargetLanguage.values()) {
            var code = TalkCompiler.compileAndValidate(RULE, CompilerConfig.forTarget(target));

            assertThat(code).as(target.displayName()).contains("SendGrid");
        }
    }

    @Test
    void compile_sharedCompiler_isThreadSafe() throws InterruptedException, ExecutionException, CompilationException {
        var compiler = TalkCompiler.builder().target(TargetLanguage.TYPESCRIPT).build();
        var expected = compiler.compile(RULE);
        var executor = Executors.newFixedThreadPool(4);
        try {
            var tasks = IntStream.range(0, 16)
                                 .mapToObj(i -> (Callable<String>) () -> compiler.compile(RULE))
                                 .toList();
            for (Future<String> result : executor.invokeAll(tasks)) {
                assertEquals(expected, result.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void compileFile_readsSource(@TempDir Path dir) throws IOException, CompilationException {
        var file = dir.resolve("signup.talk");
        Files.writeString(file, RULE);

        var code = TalkCompiler.compileFile(file, CompilerConfig.forTarget(TargetLanguage.BASH));

        assertThat(code).contains("send_email_sendgrid \"$event\"");
    }

    @Test
    void compileFile_missingFile_reportsIoError(@TempDir Path dir) {
        var file = dir.resolve("missing.talk");

        var exception = assertThrows(CompilationException.class,
                                     () -> TalkCompiler.compileFile(file, CompilerConfig.DEFAULT));

        var error = assertInstanceOf(CompilerError.IoError.class, exception.error());
        assertEquals(file.toString(), error.path());
        assertInstanceOf(NoSuchFileException.class, exception.getCause());
    }

    // === Front end only ===

    @Test
    void parse_returnsTree() throws CompilationException {
        var program = TalkCompiler.parse("send x; retries: 3");

        assertEquals(2, program.statements().size());
        assertInstanceOf(Statement.Action.class, program.statements().get(0));
        assertInstanceOf(Statement.Assignment.class, program.statements().get(1));
    }

    @Test
    void check_validSource_noError() {
        assertTrue(TalkCompiler.check(RULE).isEmpty());
        assertTrue(TalkCompiler.check("").isEmpty());
    }

    @Test
    void check_invalidSource_reportsFirstError() {
        var lexical = TalkCompiler.check("send \"unterminated");
        var parse = TalkCompiler.check("send x using");

        assertInstanceOf(CompilerError.LexicalError.class, lexical.orElseThrow());
        var error = assertInstanceOf(CompilerError.ParseError.class, parse.orElseThrow());
        assertThat(error.reason()).endsWith("found end of input");
    }

    @Test
    void check_unknownServiceIsNotAnError() {
        assertEquals(List.of(), TalkCompiler.check("send x using Mailchimp").stream().toList());
    }
}

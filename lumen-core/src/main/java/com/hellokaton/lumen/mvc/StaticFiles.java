package com.hellokaton.lumen.mvc;

import com.hellokaton.lumen.config.StaticFilesConfig;
import com.hellokaton.lumen.exception.HttpException;
import com.hellokaton.lumen.exception.NotFoundException;
import com.hellokaton.lumen.mvc.http.HttpMethod;
import lombok.Getter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serves files from a directory. The remaining request path is resolved
 * against the directory and must stay inside it.
 */
@Getter
public class StaticFiles implements Application {

    private final Path directory;

    public StaticFiles(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    public StaticFiles(StaticFilesConfig config) {
        this(config.getDirectory());
    }

    @Override
    public void handle(RouteContext context) throws Exception {
        HttpMethod method = context.request().httpMethod();
        if (method != HttpMethod.GET && method != HttpMethod.HEAD) {
            throw new HttpException(405, "Method Not Allowed");
        }
        String relative = context.path().startsWith("/") ? context.path().substring(1) : context.path();
        Path file = directory.resolve(relative).normalize();
        if (!file.startsWith(directory) || !Files.isRegularFile(file)) {
            throw new NotFoundException("Not Found");
        }
        String contentType = contentType(file);
        if (method == HttpMethod.GET) {
            context.response().text(new String(Files.readAllBytes(file), StandardCharsets.UTF_8));
        }
        context.response().header("Content-Type", null != contentType ? contentType : "application/octet-stream");
    }

    private static String contentType(Path file) {
        try {
            return Files.probeContentType(file);
        } catch (IOException e) {
            return null;
        }
    }

}

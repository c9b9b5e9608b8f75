package com.example.xlsxtpl.cli;

import com.example.xlsxtpl.service.XlsxTemplateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Renders one template from the command line:
 *
 * java -jar xlsx-template-renderer.jar --template=report.xlsx --data=data.json --output=out.xlsx
 *
 * Does nothing when --template is not given. --output defaults to the template
 * name with a "-rendered" suffix.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RenderCommandRunner implements ApplicationRunner {

    static final String TEMPLATE = "template";
    static final String DATA = "data";
    static final String OUTPUT = "output";

    private final XlsxTemplateService xlsxTemplateService;

    @Override
    public void run(ApplicationArguments args) {
        String template = option(args, TEMPLATE);
        if (template == null) {
            log.debug("No --{} argument, nothing to render", TEMPLATE);
            return;
        }
        String data = option(args, DATA);
        String output = option(args, OUTPUT);
        Path target = Path.of(output != null ? output : defaultOutput(template));
        Path written = xlsxTemplateService.renderToFile(template, data, target);
        log.info("Rendered {} -> {}", template, written);
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }

    static String defaultOutput(String template) {
        String name = template.startsWith("classpath:") ? template.substring("classpath:".length()) : template;
        name = Path.of(name).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name) + "-rendered.xlsx";
    }
}

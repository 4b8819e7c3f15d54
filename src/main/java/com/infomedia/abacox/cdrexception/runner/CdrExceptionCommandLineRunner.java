package com.infomedia.abacox.cdrexception.runner;

import com.infomedia.abacox.cdrexception.component.cdrprocessing.CdrFileDiscoveryService;
import com.infomedia.abacox.cdrexception.component.cdrprocessing.CdrProcessingException;
import com.infomedia.abacox.cdrexception.component.configmanager.ConfigService;
import com.infomedia.abacox.cdrexception.component.configmanager.ConfigurationException;
import com.infomedia.abacox.cdrexception.component.configmanager.ExceptionSettings;
import com.infomedia.abacox.cdrexception.component.exceptionanalysis.ExceptionAnalysisResult;
import com.infomedia.abacox.cdrexception.component.export.excel.ExceptionReportGenerator;
import com.infomedia.abacox.cdrexception.service.CdrExceptionAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
@Log4j2
@RequiredArgsConstructor
@ConditionalOnProperty(name = "cdr-exception.cli.enabled", havingValue = "true", matchIfMissing = true)
public class CdrExceptionCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_PROCESSING_ERROR = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_CONFIGURATION_ERROR = 3;

    private final ConfigService configService;
    private final CdrFileDiscoveryService fileDiscoveryService;
    private final CdrExceptionAnalysisService analysisService;
    private final ExceptionReportGenerator reportGenerator;

    private int exitCode = EXIT_OK;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getNonOptionArgs());
    }

    int execute(List<String> args) {
        RunArguments runArguments;
        try {
            runArguments = RunArguments.parse(args);
        } catch (IllegalArgumentException e) {
            log.error("{}", e.getMessage());
            log.error(RunArguments.USAGE);
            return EXIT_USAGE;
        }

        try {
            ExceptionSettings settings = configService.getExceptionSettings();
            List<Path> files = fileDiscoveryService.discover(runArguments.inputDirectory());
            ExceptionAnalysisResult result = analysisService.analyse(
                    files, runArguments.start(), runArguments.end(), settings);
            reportGenerator.write(result, runArguments.reportFile());
            return EXIT_OK;
        } catch (ConfigurationException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIGURATION_ERROR;
        } catch (CdrProcessingException e) {
            log.error("Processing failed: {}", e.getMessage(), e);
            return EXIT_PROCESSING_ERROR;
        } catch (IOException e) {
            log.error("Unable to write report {}", runArguments.reportFile(), e);
            return EXIT_PROCESSING_ERROR;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}

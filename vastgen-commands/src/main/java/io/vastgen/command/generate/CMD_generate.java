/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */


package io.vastgen.command.generate;

import io.vastgen.command.ExitCodes;
import io.vastgen.command.common.CacheOptions;
import io.vastgen.command.common.Progress;
import io.vastgen.variation.GenerationException;
import io.vastgen.variation.Variant;
import io.vastgen.variation.VariantGenerator;
import io.vastgen.variation.VariantWriter;
import io.vastgen.variation.distribution.InvalidDistributionException;
import io.vastgen.variation.spec.SpecParseException;
import io.vastgen.variation.spec.VariationSpecification;
import io.vastgen.variation.spec.VariationSpecificationParser;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Expands a specification into variant files and a manifest, without running anything.
 */
@Command(name = "generate",
    description = "Write one file per variant plus a manifest into the output directory")
public class CMD_generate implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_generate.class);

    @Parameters(index = "0", description = "Variation specification file")
    private Path specFile;

    @Option(names = {"-o", "--output"}, required = true, description = "Output directory")
    private Path outputDir;

    @Mixin
    private CacheOptions cacheOptions = new CacheOptions();

    @Override
    public Integer call() {
        try {
            VariationSpecification spec = new VariationSpecificationParser().load(specFile);
            VariantGenerator generator = new VariantGenerator(cacheOptions.open(specFile));
            List<Variant> variants = generator.generate(spec, Progress.toLog());
            Path manifest = new VariantWriter().write(variants, outputDir);
            System.out.println("Generated " + variants.size() + " variants, manifest " + manifest);
            return ExitCodes.SUCCESS;
        } catch (SpecParseException | InvalidDistributionException e) {
            logger.error("Invalid specification {}: {}", specFile, e.getMessage());
            return ExitCodes.ERROR;
        } catch (GenerationException e) {
            logger.error("Could not generate variants from {}: {}", specFile, e.getMessage());
            return ExitCodes.ERROR;
        } catch (IOException e) {
            logger.error("I/O error: {}", e.getMessage(), e);
            return ExitCodes.ERROR;
        }
    }
}

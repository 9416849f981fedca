package com.di.samplenova;

import com.di.samplenova.config.SubsamplingProperties;
import com.di.samplenova.config.SubsamplingSchemeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

@Slf4j
@SpringBootApplication
@EnableConfigurationProperties({ SubsamplingProperties.class, SubsamplingSchemeProperties.class })
public class SampleNovaApplication {

	public static void main(String[] args) {
		ConfigurableApplicationContext ctx = SpringApplication.run(SampleNovaApplication.class, args);
		SubsamplingProperties defaults = ctx.getBean(SubsamplingProperties.class);
		SubsamplingSchemeProperties scheme = ctx.getBean(SubsamplingSchemeProperties.class);
		// Records come from the caller; at startup only the effective configuration is reported.
		log.info("Subsampling defaults: group-by {}, max-sequences {}, sequences-per-group {}, probabilistic {}",
				defaults.getGroupBy(), defaults.getMaxSequences(), defaults.getSequencesPerGroup(),
				defaults.isProbabilisticSampling());
		if (scheme.isConfigured()) {
			log.info("Scheme configured: size {}, samples {}", scheme.getSize(), scheme.getSamples().keySet());
		}
	}
}

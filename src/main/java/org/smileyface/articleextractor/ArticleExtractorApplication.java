package org.smileyface.articleextractor;

import org.smileyface.articleextractor.config.ExtractorProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ExtractorProperties.class)
public class ArticleExtractorApplication {

	public static void main(String[] args) {
		SpringApplication.run(ArticleExtractorApplication.class, args);
	}
}

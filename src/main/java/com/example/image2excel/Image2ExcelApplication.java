package com.example.image2excel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;

/**
 * Application entry point.
 * With a positional argument (an image file or directory) the application converts it and exits
 * without starting the web server; without one it serves the HTTP conversion API.
 */
@SpringBootApplication
public class Image2ExcelApplication {

	/**
	 * Boots the Spring container.
	 *
	 * @param args {@code <input_file> [output_file]} plus optional {@code --name=value} overrides
	 */
	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(Image2ExcelApplication.class);
		if (hasPositionalArgument(args)) {
			application.setWebApplicationType(WebApplicationType.NONE);
		}
		application.run(args);
	}

	static boolean hasPositionalArgument(String[] args) {
		return Arrays.stream(args).anyMatch(arg -> !arg.startsWith("--"));
	}

}

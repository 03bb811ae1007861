package tech.andrefsramos.biz_radar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BizRadarApplication {

	public static void main(String[] args) {
		SpringApplication.run(BizRadarApplication.class, args);
	}

}

package com.nosota.msettle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MsettleApplication {
    public static void main(String[] args) {
        SpringApplication.run(MsettleApplication.class, args);
    }
}

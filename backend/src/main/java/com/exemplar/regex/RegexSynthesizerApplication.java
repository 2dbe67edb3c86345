package com.exemplar.regex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RegexSynthesizerApplication {

  public static void main(String[] args) {
    SpringApplication.run(RegexSynthesizerApplication.class, args);
  }
}

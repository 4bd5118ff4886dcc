package hunter.loadout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoadoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(LoadoutApplication.class, args);
  }
}

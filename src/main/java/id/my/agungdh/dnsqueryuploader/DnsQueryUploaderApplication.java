package id.my.agungdh.dnsqueryuploader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DnsQueryUploaderApplication {

    public static void main(String[] args) {
        // exit code non-zero kalau runner gagal (file tidak terbaca / config kosong)
        System.exit(SpringApplication.exit(SpringApplication.run(DnsQueryUploaderApplication.class, args)));
    }
}

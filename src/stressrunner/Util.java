package stressrunner;

import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import javax.servlet.http.HttpServletResponse;

import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

public class Util {

    public static <T> List<T> safeCopy(List<T> unsafe) {
        List<T> throwaway = new ArrayList<T>();
        synchronized (unsafe) {
            throwaway.addAll(unsafe);
        }
        return throwaway;
    }

    public static String formatTime(long millis) {
        return new SimpleDateFormat("yyyy-MM-dd HH:mm:ssZ").format(new Date(millis));
    }

    public static void processTemplate(HttpServletResponse response, Context context, String template)
            throws IOException {
        TemplateEngine templateEngine = new TemplateEngine();
        ClassLoaderTemplateResolver templateResolver = new ClassLoaderTemplateResolver();
        templateResolver.setTemplateMode("HTML");
        templateResolver.setCharacterEncoding("UTF-8");
        templateEngine.setTemplateResolver(templateResolver);
        templateEngine.process(template, context, response.getWriter());
    }
}

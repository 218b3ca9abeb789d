package com.flamingo.ai.slidedeck.service.render;

import com.flamingo.ai.slidedeck.domain.model.PresentationOutline;
import com.flamingo.ai.slidedeck.domain.model.SlideSpec;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.geom.Rectangle2D;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.ShapeType;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;
import org.springframework.stereotype.Component;

/**
 * Renders outlines to 16:9 PPTX decks with Apache POI.
 *
 * <p>Title slides get a tall primary-colour band, content slides a header bar with bullets, and
 * summary slides a secondary-colour header with check-marked takeaways.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PoiPresentationRenderer implements PresentationRenderer {

  // 13.333in x 7.5in in points
  static final int SLIDE_WIDTH = 960;
  static final int SLIDE_HEIGHT = 540;

  static final Color PRIMARY = new Color(0x1E, 0x40, 0xAF);
  static final Color SECONDARY = new Color(0x3B, 0x82, 0xF6);
  static final Color TEXT_DARK = new Color(0x1F, 0x29, 0x37);
  static final Color TEXT_LIGHT = Color.WHITE;

  private static final double MARGIN = 36;
  private static final double BODY_INDENT = 54;

  private final ArtifactStorage storage;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "render.pptx", description = "Time to render a presentation")
  public RenderedArtifact render(PresentationOutline outline) throws IOException {
    String artifactId = storage.newArtifactId();
    Path target = storage.allocate(artifactId);

    try (XMLSlideShow ppt = new XMLSlideShow()) {
      ppt.setPageSize(new Dimension(SLIDE_WIDTH, SLIDE_HEIGHT));
      for (SlideSpec spec : outline.slides()) {
        XSLFSlide slide = ppt.createSlide();
        switch (spec.type()) {
          case TITLE -> addTitleSlide(slide, spec);
          case CONTENT -> addContentSlide(slide, spec);
          case SUMMARY -> addSummarySlide(slide, spec);
        }
      }

      try (OutputStream out = Files.newOutputStream(target)) {
        ppt.write(out);
      }
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(target);
      throw e;
    }

    int slideCount = outline.slides().size();
    meterRegistry.counter("render.slides").increment(slideCount);
    log.info("Rendered '{}' with {} slides to {}", outline.title(), slideCount, target);
    return new RenderedArtifact(artifactId, target, slideCount);
  }

  private void addTitleSlide(XSLFSlide slide, SlideSpec spec) {
    addBand(slide, PRIMARY, 180);

    XSLFTextBox title = slide.createTextBox();
    title.setAnchor(new Rectangle2D.Double(MARGIN, 58, SLIDE_WIDTH - 2 * MARGIN, 86));
    title.setWordWrap(true);
    addRun(title, spec.heading(), 44.0, true, false, TEXT_LIGHT, TextAlign.CENTER);

    if (spec.subheading() != null && !spec.subheading().isBlank()) {
      XSLFTextBox subtitle = slide.createTextBox();
      subtitle.setAnchor(new Rectangle2D.Double(MARGIN, 144, SLIDE_WIDTH - 2 * MARGIN, 36));
      addRun(subtitle, spec.subheading(), 24.0, false, false, TEXT_LIGHT, TextAlign.CENTER);
    }
  }

  private void addContentSlide(XSLFSlide slide, SlideSpec spec) {
    addBand(slide, PRIMARY, 86);
    addHeading(slide, spec.heading());

    double bodyTop = 115;
    if (spec.subheading() != null && !spec.subheading().isBlank()) {
      XSLFTextBox sub = slide.createTextBox();
      sub.setAnchor(new Rectangle2D.Double(BODY_INDENT, 101, SLIDE_WIDTH - 2 * BODY_INDENT, 29));
      addRun(sub, spec.subheading(), 18.0, false, true, SECONDARY, TextAlign.LEFT);
      bodyTop = 137;
    }
    if (spec.hasBullets()) {
      addBullets(slide, spec.bullets(), "• ", bodyTop, 367);
    }
  }

  private void addSummarySlide(XSLFSlide slide, SlideSpec spec) {
    addBand(slide, SECONDARY, 86);
    addHeading(slide, spec.heading());
    if (spec.hasBullets()) {
      addBullets(slide, spec.bullets(), "✓ ", 115, 389);
    }
  }

  private void addBand(XSLFSlide slide, Color color, double height) {
    XSLFAutoShape band = slide.createAutoShape();
    band.setShapeType(ShapeType.RECT);
    band.setAnchor(new Rectangle2D.Double(0, 0, SLIDE_WIDTH, height));
    band.setFillColor(color);
    band.setLineColor(null);
  }

  private void addHeading(XSLFSlide slide, String heading) {
    XSLFTextBox title = slide.createTextBox();
    title.setAnchor(new Rectangle2D.Double(MARGIN, 22, SLIDE_WIDTH - 2 * MARGIN, 50));
    addRun(title, heading, 32.0, true, false, TEXT_LIGHT, TextAlign.LEFT);
  }

  private void addBullets(
      XSLFSlide slide, List<String> bullets, String prefix, double top, double height) {
    XSLFTextBox body = slide.createTextBox();
    body.setAnchor(new Rectangle2D.Double(BODY_INDENT, top, SLIDE_WIDTH - 2 * BODY_INDENT, height));
    body.setWordWrap(true);
    body.clearText();
    for (String bullet : bullets) {
      XSLFTextParagraph paragraph = body.addNewTextParagraph();
      // Negative spacing is in points.
      paragraph.setSpaceBefore(-12.0);
      paragraph.setSpaceAfter(-6.0);
      XSLFTextRun run = paragraph.addNewTextRun();
      run.setText(prefix + bullet);
      run.setFontSize(22.0);
      run.setFontColor(TEXT_DARK);
    }
  }

  private void addRun(
      XSLFTextBox box,
      String text,
      double size,
      boolean bold,
      boolean italic,
      Color color,
      TextAlign align) {
    box.clearText();
    XSLFTextParagraph paragraph = box.addNewTextParagraph();
    paragraph.setTextAlign(align);
    XSLFTextRun run = paragraph.addNewTextRun();
    run.setText(text);
    run.setFontSize(size);
    run.setBold(bold);
    run.setItalic(italic);
    run.setFontColor(color);
  }
}

package io.hearthwarrio.formschema.webdriver;

import io.hearthwarrio.formschema.core.RawElement;
import io.hearthwarrio.formschema.core.SelectOption;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.StaleElementReferenceException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

public class WebDriverElementMapperTest {
    private WebDriver driver;
    private WebDriverElementMapper mapper;

    @BeforeEach
    void setUp() {
        driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        mapper = new WebDriverElementMapper(driver);
    }

    private static WebElement control(String tag, String type, String id, String name) {
        WebElement e = mock(WebElement.class);
        when(e.getTagName()).thenReturn(tag);
        when(e.getAttribute("type")).thenReturn(type);
        when(e.getAttribute("id")).thenReturn(id);
        when(e.getAttribute("name")).thenReturn(name);
        when(e.isDisplayed()).thenReturn(true);
        when(e.isEnabled()).thenReturn(true);
        return e;
    }

    private static WebElement textElement(String text) {
        WebElement e = mock(WebElement.class);
        when(e.getText()).thenReturn(text);
        return e;
    }

    @Test
    void mapsTextInputWithLabelFor() {
        WebElement aadhaar = control("INPUT", "text", "ctl00_txtAadhaar", "ctl00$txtAadhaar");
        when(aadhaar.getAttribute("class")).thenReturn("form-control");
        when(aadhaar.getAttribute("placeholder")).thenReturn("Your Aadhaar No");
        when(aadhaar.getAttribute("required")).thenReturn("true");
        WebElement label = textElement("1. Aadhaar Number/ आधार संख्या\n *");
        when(driver.findElements(By.cssSelector("label[for='ctl00_txtAadhaar']"))).thenReturn(List.of(label));

        RawElement raw = mapper.toRawElement(aadhaar);

        assertEquals("ctl00_txtAadhaar", raw.getIdentifier());
        assertEquals("ctl00$txtAadhaar", raw.getName());
        assertEquals("text", raw.getElementKind());
        assertEquals("input", raw.getTagKind());
        assertEquals("form-control", raw.getCssClasses());
        assertEquals("Your Aadhaar No", raw.getPlaceholder());
        assertEquals("1. Aadhaar Number/ आधार संख्या *", raw.getAssociatedLabel());
        assertTrue(raw.isRequired());
        assertFalse(raw.isDisabled());
    }

    @Test
    void usesEnclosingLabelWhenNoLabelFor() {
        WebElement consent = control("input", "checkbox", "", "chkConsent");
        WebElement enclosing = textElement("I agree to the terms");
        when(((JavascriptExecutor) driver).executeScript(eq(WebDriverElementMapper.ENCLOSING_LABEL_SCRIPT), eq(consent)))
                .thenReturn(enclosing);

        RawElement raw = mapper.toRawElement(consent);

        assertEquals("checkbox", raw.getElementKind());
        assertEquals("I agree to the terms", raw.getAssociatedLabel());
    }

    @Test
    void fallsBackToParentTextWhenNoLabelElement() {
        WebElement mobile = control("input", "text", "txtMob", "mobile");
        JavascriptExecutor js = (JavascriptExecutor) driver;
        when(js.executeScript(eq(WebDriverElementMapper.ENCLOSING_LABEL_SCRIPT), eq(mobile))).thenReturn(null);
        when(js.executeScript(eq(WebDriverElementMapper.PARENT_TEXT_SCRIPT), eq(mobile)))
                .thenReturn("  Mobile   Number ");

        RawElement raw = mapper.toRawElement(mobile);

        assertEquals("Mobile Number", raw.getAssociatedLabel());
    }

    @Test
    void labelStaysEmptyWhenParentHasNoText() {
        WebElement field = control("input", "text", "txtBare", "bare");
        when(((JavascriptExecutor) driver).executeScript(anyString(), eq(field))).thenReturn("");

        assertEquals("", mapper.toRawElement(field).getAssociatedLabel());
    }

    @Test
    void readsSelectOptions() {
        WebElement state = control("select", "select-one", "ddlState", "state");
        WebElement placeholder = mock(WebElement.class);
        when(placeholder.getAttribute("value")).thenReturn("");
        when(placeholder.getText()).thenReturn("Select");
        WebElement karnataka = mock(WebElement.class);
        when(karnataka.getAttribute("value")).thenReturn("29");
        when(karnataka.getText()).thenReturn(" KARNATAKA ");
        when(state.findElements(By.tagName("option"))).thenReturn(List.of(placeholder, karnataka));

        RawElement raw = mapper.toRawElement(state);

        assertEquals(List.of(new SelectOption("", "Select"), new SelectOption("29", "KARNATAKA")), raw.getOptions());
    }

    @Test
    void buttonLabelComesFromItsText() {
        WebElement button = control("button", "submit", "btnValidate", "");
        when(button.getText()).thenReturn("Validate & Generate OTP");

        assertEquals("Validate & Generate OTP", mapper.toRawElement(button).getAssociatedLabel());
    }

    @Test
    void submitInputLabelComesFromItsValue() {
        WebElement submit = control("input", "submit", "btnContinue", "btnContinue");
        when(submit.getAttribute("value")).thenReturn("Continue");

        RawElement raw = mapper.toRawElement(submit);

        assertEquals("Continue", raw.getAssociatedLabel());
        assertEquals("Continue", raw.getCurrentValue());
    }

    @Test
    void collectsOnlyVisibleControls() {
        WebElement visible = control("input", "text", "txtPan", "pan");
        WebElement hidden = control("input", "text", "txtHidden", "hidden");
        when(hidden.isDisplayed()).thenReturn(false);
        WebElement stale = control("input", "text", "txtStale", "stale");
        when(stale.isDisplayed()).thenThrow(new StaleElementReferenceException("gone"));
        when(driver.findElements(By.cssSelector(WebDriverElementMapper.CONTROL_SELECTOR)))
                .thenReturn(List.of(visible, hidden, stale));

        List<RawElement> raw = mapper.collectVisibleControls(null);

        assertEquals(1, raw.size());
        assertEquals("txtPan", raw.get(0).getIdentifier());
    }

    @Test
    void scopesCollectionToContainer() {
        WebElement root = mock(WebElement.class);
        WebElement inside = control("input", "text", "txtOtp", "otp");
        when(root.findElements(By.cssSelector(WebDriverElementMapper.CONTROL_SELECTOR))).thenReturn(List.of(inside));

        List<RawElement> raw = mapper.collectVisibleControls(root);

        assertEquals(1, raw.size());
        verify(driver, never()).findElements(By.cssSelector(WebDriverElementMapper.CONTROL_SELECTOR));
    }
}

package com.example.demo.xlsxgen.renderer;

/**
 * Produces the XML of one package part.
 */
public interface PartRenderer {

    String render();
}

package com.gradspider.sites;

import com.gradspider.scraper.ListScanner;
import com.gradspider.scraper.ProgramExtractor;
import com.gradspider.scraper.UniversityProfile;

/**
 * Site adapter for one university: knows how to list its programs and read one program's details.
 */
public interface UniversitySite extends ListScanner, ProgramExtractor {

    UniversityProfile profile();
}
